package name.monarchy.strategy;

import name.monarchy.kingdom.GamePhase;
import name.monarchy.kingdom.Race;
import name.monarchy.personality.Personality;
import name.monarchy.personality.Traits;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;

/**
 * Racial spending split between economy, military and defense, bent by personality.
 */
public final class RaceStrategy {
    private RaceStrategy() {}

    public record Allocation(double economic, double military, double defensive) {}

    private static final EnumMap<Race, Allocation> BASE = new EnumMap<>(Race.class);

    static {
        BASE.put(Race.HUMAN,  new Allocation(50, 30, 20));
        BASE.put(Race.DROBEN, new Allocation(35, 45, 20));
        BASE.put(Race.ELVEN,  new Allocation(25, 35, 40));
        BASE.put(Race.GOBLIN, new Allocation(25, 50, 25));
    }

    public static Allocation base(Race race) {
        return BASE.getOrDefault(race, BASE.get(Race.HUMAN));
    }

    /** Each share scaled by its driving trait and clamped to 10..70 percent. */
    public static Allocation forPersonality(Personality p) {
        Allocation b = base(p.race());
        Traits t = p.traits();
        return new Allocation(
                clamp(b.economic() * t.economy()),
                clamp(b.military() * t.aggression()),
                clamp(b.defensive() * (2.0 - t.risk()))
        );
    }

    public static List<String> strategicAdvice(Personality p, GamePhase phase) {
        Allocation a = forPersonality(p);
        List<String> out = new ArrayList<>();
        out.add(p.fullName() + " (" + p.persona().id() + ", " + p.playstyle().id() + ") favours "
                + p.behavior().militaryStrategy() + " and " + p.behavior().economicStrategy());
        out.add(String.format(Locale.US, "Spend roughly %.0f%% economy, %.0f%% military, %.0f%% defense",
                a.economic(), a.military(), a.defensive()));
        switch (phase) {
            case EARLY -> out.add("Early game: grow land and income before committing troops");
            case MID -> out.add("Mid game: convert economy into army and take efficient hits");
            case LATE -> out.add("Late game: protect gains and strike only with overwhelming odds");
        }
        if (p.modifiers().attackThreshold() < 0.8) {
            out.add("Low attack threshold: will engage even close fights");
        }
        return out;
    }

    private static double clamp(double v) {
        return Math.max(10.0, Math.min(70.0, v));
    }
}
