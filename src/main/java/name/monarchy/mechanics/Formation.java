package name.monarchy.mechanics;

import name.monarchy.kingdom.UnitStack;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Named battle formations. A formation's own offense/defense fractions are combined with
 * the bonuses that fall out of the army's composition.
 */
public enum Formation {
    STANDARD       ("standard",        0.0,   0.0),
    BALANCED       ("balanced",        0.10,  0.10),
    AGGRESSIVE     ("aggressive",      0.15,  0.0),
    DEFENSIVE      ("defensive",      -0.10,  0.25),
    DEFENSIVE_WALL ("defensive-wall", -0.10,  0.25),
    CAVALRY_CHARGE ("cavalry-charge",  0.30, -0.15),
    FLANKING       ("flanking",        0.10,  0.0),
    SIEGE          ("siege",           0.20,  0.0);

    public final String id;
    public final double offense;
    public final double defense;

    Formation(String id, double offense, double defense) {
        this.id = id;
        this.offense = offense;
        this.defense = defense;
    }

    /** Null for unknown ids. */
    public static Formation byId(String id) {
        if (id == null) return null;
        String key = id.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (Formation f : values()) {
            if (f.id.equals(key)) return f;
        }
        return null;
    }

    /** Percentage bonuses (15 = +15%) derived from unit composition. */
    public record CompositionBonus(double attackPct, double defensePct, List<String> tags) {
        public static final CompositionBonus NONE = new CompositionBonus(0, 0, List.of());
    }

    public static CompositionBonus compositionBonus(List<UnitStack> units) {
        if (units == null || units.isEmpty()) return CompositionBonus.NONE;

        int infantryLine = 0;   // knights + militia
        int cavalry = 0;
        int ranged = 0;         // archers + mages
        for (UnitStack u : units) {
            if (u.count() <= 0) continue;
            switch (u.type()) {
                case KNIGHT, MILITIA -> infantryLine += u.count();
                case CAVALRY, TIER4 -> cavalry += u.count();
                case ARCHER, MAGE -> ranged += u.count();
                default -> { }
            }
        }

        double atk = 0, def = 0;
        List<String> tags = new ArrayList<>();
        if (infantryLine >= 2) { def += 15; tags.add("shield_wall"); }
        if (cavalry > 0)       { atk += 20; tags.add("mobility"); }
        if (ranged >= 2)       { atk += 10; tags.add("ranged_advantage"); }
        return new CompositionBonus(atk, def, List.copyOf(tags));
    }
}
