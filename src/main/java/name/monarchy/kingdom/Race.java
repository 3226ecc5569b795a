package name.monarchy.kingdom;

import java.util.Locale;

/**
 * Playable races. Stats are on a 1..5 scale where 3 is average.
 */
public enum Race {
    //        off def sor scum fort tithe train siege eco build
    HUMAN    (3, 3, 3, 4, 3, 4, 3, 3, 5, 3),
    ELVEN    (2, 4, 4, 3, 3, 3, 5, 3, 3, 3),
    GOBLIN   (4, 3, 2, 2, 3, 3, 4, 5, 3, 4),
    DROBEN   (5, 3, 2, 3, 3, 3, 3, 4, 2, 3),
    VAMPIRE  (3, 4, 4, 4, 5, 2, 3, 3, 2, 3),
    ELEMENTAL(4, 3, 4, 2, 4, 3, 3, 3, 3, 5),
    CENTAUR  (2, 2, 2, 5, 3, 3, 4, 3, 2, 2),
    SIDHE    (2, 3, 5, 4, 4, 3, 3, 2, 3, 3),
    DWARVEN  (3, 5, 2, 2, 4, 4, 3, 4, 2, 4),
    FAE      (3, 3, 4, 3, 3, 5, 3, 2, 4, 3);

    public final int warOffense;
    public final int warDefense;
    public final int sorcery;
    public final int scum;
    public final int forts;
    public final int tithe;
    public final int training;
    public final int siege;
    public final int economy;
    public final int building;

    Race(int warOffense, int warDefense, int sorcery, int scum, int forts,
         int tithe, int training, int siege, int economy, int building) {
        this.warOffense = warOffense;
        this.warDefense = warDefense;
        this.sorcery = sorcery;
        this.scum = scum;
        this.forts = forts;
        this.tithe = tithe;
        this.training = training;
        this.siege = siege;
        this.economy = economy;
        this.building = building;
    }

    /** Offense multiplier relative to an average race (3). */
    public double offenseScale() {
        return warOffense / 3.0;
    }

    public double defenseScale() {
        return warDefense / 3.0;
    }

    public String displayName() {
        String n = name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(n.charAt(0)) + n.substring(1);
    }

    /** Case-insensitive lookup. Returns null for names outside the table. */
    public static Race byName(String name) {
        if (name == null) return null;
        String key = name.trim().toUpperCase(Locale.ROOT);
        for (Race r : values()) {
            if (r.name().equals(key)) return r;
        }
        return null;
    }
}
