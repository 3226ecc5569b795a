package name.monarchy.strategy;

public enum RiskLevel { LOW, MEDIUM, HIGH }
