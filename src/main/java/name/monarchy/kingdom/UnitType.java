package name.monarchy.kingdom;

import java.util.Locale;

/**
 * Base unit stats. Unknown unit ids fall back to {@link #GENERIC} (2/2).
 */
public enum UnitType {
    //          atk def  hp  class
    PEASANT    (1, 1, 10, UnitClass.INFANTRY),
    MILITIA    (2, 3, 20, UnitClass.INFANTRY),
    KNIGHT     (6, 4, 40, UnitClass.INFANTRY),
    CAVALRY    (5, 3, 30, UnitClass.CAVALRY),
    INFANTRY   (3, 2, 20, UnitClass.INFANTRY),
    ARCHER     (4, 2, 15, UnitClass.OTHER),
    MAGE       (3, 1, 12, UnitClass.OTHER),
    SCOUT      (2, 1, 10, UnitClass.OTHER),
    CATAPULT   (6, 1, 25, UnitClass.SIEGE),
    BALLISTA   (5, 1, 25, UnitClass.SIEGE),
    TIER1      (1, 1, 10, UnitClass.INFANTRY),
    TIER2      (3, 2, 20, UnitClass.INFANTRY),
    TIER3      (5, 3, 40, UnitClass.INFANTRY),
    TIER4      (7, 4, 30, UnitClass.CAVALRY),
    GENERIC    (2, 2, 15, UnitClass.OTHER);

    public final int attack;
    public final int defense;
    public final int health;
    public final UnitClass unitClass;

    UnitType(int attack, int defense, int health, UnitClass unitClass) {
        this.attack = attack;
        this.defense = defense;
        this.health = health;
        this.unitClass = unitClass;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static UnitType byId(String id) {
        if (id == null) return GENERIC;
        String key = id.trim().toUpperCase(Locale.ROOT);
        for (UnitType t : values()) {
            if (t.name().equals(key)) return t;
        }
        return GENERIC;
    }
}
