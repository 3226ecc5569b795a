package name.monarchy.build;

import name.monarchy.kingdom.GamePhase;
import name.monarchy.kingdom.Race;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Race and phase specific construction queues.
 */
public final class BuildOrderOptimizer {
    private BuildOrderOptimizer() {}

    /** Priorities closer than this are treated as equal and ordered by efficiency. */
    public static final double PRIORITY_TIE_WINDOW = 0.5;

    private static final double ECONOMIC_COMPOUNDING = 10.0;
    private static final double STRATEGIC_BENEFIT_WEIGHT = 0.5;

    private static final EnumMap<Race, List<BuildStep>> TEMPLATES = new EnumMap<>(Race.class);
    private static final EnumMap<GamePhase, Map<BuildStepType, Double>> PHASE = new EnumMap<>(GamePhase.class);

    static {
        TEMPLATES.put(Race.HUMAN, List.of(
                step(BuildStepType.ECONOMIC, 10, 2000, 2, 500, "Tithe buildings (leverage tithe bonus)"),
                step(BuildStepType.ECONOMIC, 9, 1500, 1, 300, "Trade infrastructure (caravan frequency bonus)"),
                step(BuildStepType.MILITARY, 7, 3000, 2, 800, "Balanced military training"),
                step(BuildStepType.EXPANSION, 8, 2500, 3, 1000, "Land expansion for economic base")
        ));
        TEMPLATES.put(Race.DROBEN, List.of(
                step(BuildStepType.MILITARY, 10, 4000, 2, 1200, "Elite training facilities"),
                step(BuildStepType.MILITARY, 9, 3500, 2, 1000, "Advanced siege equipment"),
                step(BuildStepType.DEFENSIVE, 8, 2500, 1, 600, "Fortifications"),
                step(BuildStepType.EXPANSION, 7, 3000, 4, 1500, "Aggressive land acquisition")
        ));
        TEMPLATES.put(Race.ELVEN, List.of(
                step(BuildStepType.MILITARY, 10, 3500, 1, 1400, "Superior training"),
                step(BuildStepType.DEFENSIVE, 9, 3000, 2, 900, "Defensive positions"),
                step(BuildStepType.ECONOMIC, 7, 2000, 2, 400, "Support infrastructure"),
                step(BuildStepType.EXPANSION, 6, 2500, 3, 800, "Controlled expansion")
        ));
        TEMPLATES.put(Race.GOBLIN, List.of(
                step(BuildStepType.MILITARY, 10, 2500, 1, 1000, "Fast military buildup"),
                step(BuildStepType.MILITARY, 9, 2000, 1, 800, "Mass unit training"),
                step(BuildStepType.EXPANSION, 8, 1500, 2, 1200, "Early land grab"),
                step(BuildStepType.ECONOMIC, 5, 1000, 1, 200, "Minimal economic support")
        ));
        TEMPLATES.put(Race.VAMPIRE, List.of(
                step(BuildStepType.MILITARY, 10, 5000, 3, 1500, "Elite vampire units"),
                step(BuildStepType.ECONOMIC, 8, 4000, 2, 800, "Resource generation to offset upkeep"),
                step(BuildStepType.EXPANSION, 7, 3500, 4, 1800, "High-value land acquisition")
        ));

        PHASE.put(GamePhase.EARLY, phase(1.3, 0.8, 0.7, 1.1));
        PHASE.put(GamePhase.MID,   phase(1.0, 1.2, 1.0, 1.3));
        PHASE.put(GamePhase.LATE,  phase(0.8, 1.4, 1.2, 0.9));
    }

    private static BuildStep step(BuildStepType t, double priority, long gold, int turns, double benefit, String desc) {
        return new BuildStep(t, priority, gold, turns, benefit, desc);
    }

    private static Map<BuildStepType, Double> phase(double eco, double mil, double def, double exp) {
        EnumMap<BuildStepType, Double> m = new EnumMap<>(BuildStepType.class);
        m.put(BuildStepType.ECONOMIC, eco);
        m.put(BuildStepType.MILITARY, mil);
        m.put(BuildStepType.DEFENSIVE, def);
        m.put(BuildStepType.EXPANSION, exp);
        return m;
    }

    public static List<BuildStep> template(Race race) {
        return TEMPLATES.getOrDefault(race, TEMPLATES.get(Race.HUMAN));
    }

    public static double phaseModifier(GamePhase phase, BuildStepType type) {
        return PHASE.get(phase).getOrDefault(type, 1.0);
    }

    // =========================
    // Generation
    // =========================

    /** Affordable template steps, re-weighted for the phase. */
    public static BuildOrder optimize(Race race, GamePhase phase, double gold, int turns) {
        List<BuildStep> steps = new ArrayList<>();
        for (BuildStep s : template(race)) {
            if (s.goldCost() > gold || s.turnCost() > turns) continue;
            steps.add(s.withPriority(s.priority() * phaseModifier(phase, s.type())));
        }
        return assemble(race, phase, order(steps));
    }

    /** Threat, opportunity and resource-pressure signals applied to an existing order. */
    public static BuildOrder adapt(BuildOrder base, BuildSignals signals) {
        List<BuildStep> steps = new ArrayList<>(base.steps().size());
        for (BuildStep s : base.steps()) {
            double p = s.priority();
            if (signals.threats() > 2 && s.type() == BuildStepType.DEFENSIVE) p *= 1.5;
            if (signals.opportunities() > 2 && s.type() == BuildStepType.MILITARY) p *= 1.3;
            if (signals.resourcePressure() == BuildSignals.ResourcePressure.HIGH
                    && s.type() == BuildStepType.ECONOMIC) p *= 1.4;
            steps.add(s.withPriority(p));
        }
        return assemble(base.race(), base.phase(), order(steps));
    }

    public static BuildOrder optimize(Race race, GamePhase phase, double gold, int turns, BuildSignals signals) {
        return adapt(optimize(race, phase, gold, turns), signals == null ? BuildSignals.CALM : signals);
    }

    public static BuildStep nextStep(Race race, GamePhase phase, double gold, int turns, BuildSignals signals) {
        List<BuildStep> steps = optimize(race, phase, gold, turns, signals).steps();
        return steps.isEmpty() ? null : steps.get(0);
    }

    /** Walks the queue spending gold and turns, reporting every step that can no longer be paid for. */
    public static BuildOrder.Validation validate(BuildOrder order, double gold, int turns) {
        List<String> issues = new ArrayList<>();
        double g = gold;
        int t = turns;
        for (BuildStep s : order.steps()) {
            if (s.goldCost() > g) {
                issues.add("Insufficient gold for " + s.description() + " (need " + s.goldCost() + ", have " + (long) g + ")");
            }
            if (s.turnCost() > t) {
                issues.add("Insufficient turns for " + s.description() + " (need " + s.turnCost() + ", have " + t + ")");
            }
            g -= s.goldCost();
            t -= s.turnCost();
        }
        return new BuildOrder.Validation(issues.isEmpty(), issues);
    }

    /**
     * Priority descending; steps within the tie window of the best remaining priority
     * are ordered by efficiency. Done as repeated selection so the tolerance never has to
     * behave like a total order.
     */
    static List<BuildStep> order(List<BuildStep> steps) {
        List<BuildStep> remaining = new ArrayList<>(steps);
        List<BuildStep> out = new ArrayList<>(steps.size());
        while (!remaining.isEmpty()) {
            double top = Double.NEGATIVE_INFINITY;
            for (BuildStep s : remaining) top = Math.max(top, s.priority());

            BuildStep pick = null;
            for (BuildStep s : remaining) {
                if (top - s.priority() > PRIORITY_TIE_WINDOW) continue;
                if (pick == null || s.efficiency() > pick.efficiency()) pick = s;
            }
            remaining.remove(pick);
            out.add(pick);
        }
        return out;
    }

    public static double expectedNetworth(List<BuildStep> steps) {
        double total = 0;
        for (BuildStep s : steps) {
            total += switch (s.type()) {
                case ECONOMIC -> s.expectedBenefit() * ECONOMIC_COMPOUNDING;
                case EXPANSION -> s.expectedBenefit();
                case MILITARY, DEFENSIVE -> s.expectedBenefit() * STRATEGIC_BENEFIT_WEIGHT;
            };
        }
        return total;
    }

    private static BuildOrder assemble(Race race, GamePhase phase, List<BuildStep> steps) {
        long gold = 0;
        int turns = 0;
        for (BuildStep s : steps) {
            gold += s.goldCost();
            turns += s.turnCost();
        }
        return new BuildOrder(race, phase, steps, gold, turns, expectedNetworth(steps));
    }
}
