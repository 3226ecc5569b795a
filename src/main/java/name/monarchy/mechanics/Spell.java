package name.monarchy.mechanics;

import java.util.Locale;

public enum Spell {
    ROUSING_WIND(1, 1, false),
    SHATTERING_CALM(1, 2, false),
    HURRICANE(2, 3, false),
    LIGHTNING_LANCE(2, 3, false),
    BANSHEE_DELUGE(3, 5, false),
    FOUL_LIGHT(4, 8, true);

    public final int tier;
    public final int elanCost;
    public final boolean targetsPopulation;

    Spell(int tier, int elanCost, boolean targetsPopulation) {
        this.tier = tier;
        this.elanCost = elanCost;
        this.targetsPopulation = targetsPopulation;
    }

    /** Null for unknown names. */
    public static Spell byName(String name) {
        if (name == null) return null;
        String key = name.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (Spell s : values()) {
            if (s.name().equals(key)) return s;
        }
        return null;
    }
}
