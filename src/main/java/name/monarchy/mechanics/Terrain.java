package name.monarchy.mechanics;

import name.monarchy.kingdom.UnitClass;

import java.util.Locale;

/**
 * Battlefield terrain. Offense and defense are flat fractions; the class deltas stack on top
 * of offense for the matching unit class.
 */
public enum Terrain {
    //          off    def    cav    siege  inf
    PLAINS     ( 0.0,   0.0,   0.0,   0.0,   0.0),
    FOREST     ( 0.0,   0.20, -0.10,  0.0,   0.0),
    MOUNTAINS  ( 0.0,   0.30,  0.0,  -0.20,  0.0),
    SWAMP      (-0.15, -0.15, -0.15,  0.0,  -0.15),
    DESERT     ( 0.0,   0.0,   0.15,  0.0,  -0.10),
    COASTAL    ( 0.0,   0.0,   0.0,   0.0,   0.0);

    public final double offense;
    public final double defense;
    public final double cavalry;
    public final double siege;
    public final double infantry;

    Terrain(double offense, double defense, double cavalry, double siege, double infantry) {
        this.offense = offense;
        this.defense = defense;
        this.cavalry = cavalry;
        this.siege = siege;
        this.infantry = infantry;
    }

    public double classModifier(UnitClass c) {
        return switch (c) {
            case CAVALRY -> cavalry;
            case SIEGE -> siege;
            case INFANTRY -> infantry;
            case OTHER -> 0.0;
        };
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Null for unknown ids. */
    public static Terrain byId(String id) {
        if (id == null) return null;
        String key = id.trim().toUpperCase(Locale.ROOT);
        for (Terrain t : values()) {
            if (t.name().equals(key)) return t;
        }
        return null;
    }
}
