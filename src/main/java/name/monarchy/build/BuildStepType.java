package name.monarchy.build;

public enum BuildStepType { ECONOMIC, MILITARY, DEFENSIVE, EXPANSION }
