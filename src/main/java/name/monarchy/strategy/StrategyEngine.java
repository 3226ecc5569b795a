package name.monarchy.strategy;

import name.monarchy.kingdom.GamePhase;
import name.monarchy.kingdom.Kingdom;
import name.monarchy.personality.Personality;
import name.monarchy.personality.Traits;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Turns a kingdom's state and personality into ranked candidate actions.
 */
public final class StrategyEngine {
    private StrategyEngine() {}

    // -------------------------
    // Policy knobs
    // -------------------------
    public static final int MIN_ATTACK_TURNS = 4;
    public static final double MIN_ATTACK_SUCCESS = 0.7;
    public static final double THREAT_NETWORTH_SHARE = 0.8;

    private static final double BUILD_COST_PER_ACRE = 2.5;
    private static final double GOLD_PER_ACRE_BUILT = 500.0;
    private static final double MAX_UNITS_PER_ACRE = 3.0;
    private static final double THIN_ARMY_UNITS_PER_ACRE = 1.5;
    private static final double TRAIN_COST_PER_UNIT = 10.0;
    private static final double TRAIN_BASE_COST = 1000.0;
    public static final double GOLD_PER_RECRUIT = 50.0;
    private static final double DEFENSE_GOLD_SHARE = 0.3;

    /** Highest priority first; equal priorities resolve BUILD, TRAIN, ATTACK, DEFEND. */
    public static final Comparator<StrategicDecision> SELECTION_ORDER =
            Comparator.comparingInt(StrategicDecision::priority).reversed()
                    .thenComparingInt(d -> d.action().ordinal());

    public static final List<StrategyRule> RULES = List.of(
            new StrategyRule(ActionType.BUILD,
                    ctx -> ctx.self().gold >= buildCost(ctx.self()),
                    StrategyEngine::scoreBuild),
            new StrategyRule(ActionType.TRAIN,
                    ctx -> unitsPerLand(ctx.self()) <= MAX_UNITS_PER_ACRE
                            && ctx.self().gold >= trainCost(ctx.self()),
                    StrategyEngine::scoreTrain),
            new StrategyRule(ActionType.ATTACK,
                    ctx -> ctx.self().turns >= MIN_ATTACK_TURNS,
                    StrategyEngine::scoreAttack),
            new StrategyRule(ActionType.DEFEND,
                    ctx -> !threats(ctx).isEmpty(),
                    StrategyEngine::scoreDefend)
    );

    // =========================
    // Entry points
    // =========================

    /** All candidates that survive their guards, in rule order. */
    public static List<StrategicDecision> candidates(StrategyContext ctx) {
        List<StrategicDecision> out = new ArrayList<>(RULES.size());
        for (StrategyRule rule : RULES) {
            StrategicDecision d = rule.evaluate(ctx);
            if (d != null) out.add(d);
        }
        return out;
    }

    public static StrategicDecision choose(List<StrategicDecision> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return StrategicDecision.waitTurn("No affordable action this turn; saving resources");
        }
        return candidates.stream().min(SELECTION_ORDER).orElseThrow();
    }

    public static StrategicDecision decide(StrategyContext ctx) {
        return choose(candidates(ctx));
    }

    public static StrategicDecision decide(Kingdom self, Personality personality, List<Kingdom> rivals, int turn) {
        return decide(new StrategyContext(self, personality, rivals, GamePhase.ofTurn(turn), null));
    }

    // =========================
    // Scorers
    // =========================

    static StrategicDecision scoreBuild(StrategyContext ctx) {
        Kingdom k = ctx.self();
        long cost = buildCost(k);
        int land = (int) Math.floor(cost / GOLD_PER_ACRE_BUILT);
        int base = ctx.phase() == GamePhase.EARLY ? 8 : 5;
        int priority = (int) Math.floor(base * ctx.personality().modifiers().buildPriority() / 10.0);

        return new StrategicDecision(ActionType.BUILD, priority,
                new ResourceAllocation(cost, 1, 0, land * 1000.0),
                null, land, riskFromTrait(ctx.personality().traits()),
                List.of("Build " + land + " acres of infrastructure for " + cost + " gold",
                        "Economic focus " + fmt(ctx.personality().traits().economy())
                                + " in " + ctx.phase().name().toLowerCase(Locale.ROOT) + " game"));
    }

    static StrategicDecision scoreTrain(StrategyContext ctx) {
        Kingdom k = ctx.self();
        double upl = unitsPerLand(k);
        long cost = trainCost(k);
        int recruits = (int) Math.floor(cost / GOLD_PER_RECRUIT);
        int priority = upl < THIN_ARMY_UNITS_PER_ACRE ? 9 : 6;

        return new StrategicDecision(ActionType.TRAIN, priority,
                new ResourceAllocation(cost, 1, recruits, recruits),
                null, 0, RiskLevel.LOW,
                List.of("Train " + recruits + " units for " + cost + " gold",
                        "Army density " + fmt(upl) + " units per acre"));
    }

    static StrategicDecision scoreAttack(StrategyContext ctx) {
        Kingdom k = ctx.self();
        List<CombatForecast> viable = new ArrayList<>();
        for (Kingdom t : ctx.rivals()) {
            if (!ctx.mayAttack(t)) continue;
            CombatForecast f = CombatForecast.of(k, t);
            if (f.successProbability() <= MIN_ATTACK_SUCCESS) continue;
            if (f.turnCost() > k.turns) continue;
            viable.add(f);
        }
        if (viable.isEmpty()) return null;

        viable.sort(Comparator.comparingDouble(CombatForecast::efficiency).reversed()
                .thenComparing(CombatForecast::targetId));
        CombatForecast best = viable.get(0);

        int priority = best.efficiency() > 2 ? 10 : 7;
        RiskLevel risk = best.successProbability() > 0.9 ? RiskLevel.LOW : RiskLevel.MEDIUM;
        return new StrategicDecision(ActionType.ATTACK, priority,
                new ResourceAllocation(0, best.turnCost(), 0, best.expectedLand() * 1000.0),
                best.targetId(), best.expectedLand(), risk,
                List.of("Attack " + best.targetId() + " for ~" + best.expectedLand() + " acres in "
                                + best.turnCost() + " turns",
                        "Success " + pct(best.successProbability()) + ", efficiency "
                                + fmt(best.efficiency()) + " acres/turn",
                        viable.size() + " viable target(s) considered"));
    }

    static StrategicDecision scoreDefend(StrategyContext ctx) {
        Kingdom k = ctx.self();
        List<Kingdom> threats = threats(ctx);
        int priority = threats.size() > 1 ? 11 : 8;
        long gold = (long) Math.floor(k.gold * DEFENSE_GOLD_SHARE);
        int recruits = (int) Math.floor(gold / GOLD_PER_RECRUIT);

        return new StrategicDecision(ActionType.DEFEND, priority,
                new ResourceAllocation(gold, 0, recruits, 0),
                null, 0, threats.size() > 1 ? RiskLevel.HIGH : RiskLevel.MEDIUM,
                List.of("Reinforce defenses against " + threats.size() + " threat(s)",
                        "Strongest threat " + threats.get(0).id + " at "
                                + fmt(threats.get(0).networth() / Math.max(1.0, k.networth())) + "x networth"));
    }

    // =========================
    // Helpers
    // =========================

    /** Rivals above 0.8x our networth that can afford an attack, strongest first. */
    public static List<Kingdom> threats(StrategyContext ctx) {
        double self = ctx.self().networth();
        List<Kingdom> out = new ArrayList<>();
        for (Kingdom r : ctx.rivals()) {
            if (r.id.equals(ctx.self().id)) continue;
            if (r.networth() > THREAT_NETWORTH_SHARE * self && r.turns >= MIN_ATTACK_TURNS) out.add(r);
        }
        out.sort(Comparator.comparingDouble(Kingdom::networth).reversed());
        return out;
    }

    public static long buildCost(Kingdom k) {
        return (long) Math.floor(k.land * BUILD_COST_PER_ACRE);
    }

    public static long trainCost(Kingdom k) {
        return (long) Math.floor(k.totalUnits() * TRAIN_COST_PER_UNIT + TRAIN_BASE_COST);
    }

    public static double unitsPerLand(Kingdom k) {
        return k.totalUnits() / Math.max(1.0, k.land);
    }

    static RiskLevel riskFromTrait(Traits t) {
        if (t.risk() > 1.2) return RiskLevel.HIGH;
        if (t.risk() < 0.8) return RiskLevel.LOW;
        return RiskLevel.MEDIUM;
    }

    private static String fmt(double v) {
        return String.format(Locale.US, "%.2f", v);
    }

    private static String pct(double v) {
        return String.format(Locale.US, "%.0f%%", v * 100);
    }
}
