package name.monarchy.target;

public enum Recommendation { PRIME, GOOD, RISKY, AVOID }
