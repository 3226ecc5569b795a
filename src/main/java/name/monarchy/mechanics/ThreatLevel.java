package name.monarchy.mechanics;

public enum ThreatLevel { LOW, MEDIUM, HIGH }
