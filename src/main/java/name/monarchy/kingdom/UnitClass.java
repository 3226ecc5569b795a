package name.monarchy.kingdom;

/** Coarse grouping used by terrain penalties. */
public enum UnitClass { INFANTRY, CAVALRY, SIEGE, OTHER }
