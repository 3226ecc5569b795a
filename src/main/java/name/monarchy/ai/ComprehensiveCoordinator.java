package name.monarchy.ai;

import name.monarchy.InvalidInputException;
import name.monarchy.Monarchy;
import name.monarchy.build.BuildOrder;
import name.monarchy.build.BuildOrderOptimizer;
import name.monarchy.build.BuildSignals;
import name.monarchy.kingdom.Kingdom;
import name.monarchy.personality.Personality;
import name.monarchy.personality.PersonalityGenerator;
import name.monarchy.strategy.ActionType;
import name.monarchy.strategy.RaceStrategy;
import name.monarchy.strategy.RiskLevel;
import name.monarchy.strategy.StrategicDecision;
import name.monarchy.strategy.StrategyContext;
import name.monarchy.strategy.StrategyEngine;
import name.monarchy.target.AttackPlan;
import name.monarchy.target.Recommendation;
import name.monarchy.target.TargetAnalysis;
import name.monarchy.target.TargetSelector;
import name.monarchy.war.WarDeclaration;
import name.monarchy.war.WarState;
import name.monarchy.war.WarStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs every AI subsystem for one kingdom and folds the results into a single decision.
 * One instance serves a whole world; all shared state lives in the collaborators passed in.
 */
public final class ComprehensiveCoordinator {

    // -------------------------
    // Confidence knobs
    // -------------------------
    private static final double BASE_CONFIDENCE = 0.5;
    private static final double MIN_CONFIDENCE = 0.1;
    private static final double MAX_CONFIDENCE = 1.0;
    private static final int HIGH_PRIORITY = 8;

    private static final int ADAPT_WINDOW = 10;
    private static final double POOR_ATTACK_SUCCESS = 0.6;
    private static final double SLOW_GROWTH = 0.03;

    private final PersonalityGenerator personalities;
    private final WarState wars;
    private final DecisionHistory history;
    private final boolean autoDeclareWar;

    public ComprehensiveCoordinator(PersonalityGenerator personalities, WarState wars,
                                    DecisionHistory history, boolean autoDeclareWar) {
        this.personalities = InvalidInputException.requirePresent("personalities", personalities);
        this.wars = InvalidInputException.requirePresent("wars", wars);
        this.history = InvalidInputException.requirePresent("history", history);
        this.autoDeclareWar = autoDeclareWar;
    }

    public DecisionHistory history() {
        return history;
    }

    /**
     * Decide what {@code kingdom} does this tick. {@code world} is every kingdom still in play and
     * may include {@code kingdom} itself. Nothing on the kingdoms is mutated; the only side effects
     * are the history entry and, with auto-declaration on, a war declaration against a target
     * that required one.
     */
    public ComprehensiveDecision makeDecision(Kingdom kingdom, List<Kingdom> world, long tick) {
        InvalidInputException.requirePresent("kingdom", kingdom).validate();
        InvalidInputException.requirePresent("world", world);
        for (Kingdom k : world) k.validate();

        int turn = (int) Math.min(Integer.MAX_VALUE, Math.max(0, tick));
        GameAnalysis analysis = GameAnalysis.of(kingdom, world, turn);
        Personality personality = personalities.generate(kingdom.id, kingdom.race);

        // kingdoms under restoration protection can neither strike nor be struck
        List<Kingdom> rivals = kingdom.isInRestoration(tick) ? List.of() : engageable(kingdom, world, tick);

        StrategicDecision primary = StrategyEngine.decide(
                new StrategyContext(kingdom, personality, rivals, analysis.phase(), wars, autoDeclareWar));

        BuildSignals signals = new BuildSignals(analysis.threats().size(), analysis.opportunities().size(),
                ResourceManager.pressure(kingdom));
        BuildOrder build = BuildOrderOptimizer.optimize(kingdom.race, analysis.phase(),
                kingdom.gold, kingdom.turns, signals);

        List<TargetAnalysis> targets = TargetSelector.analyzeTargets(kingdom, rivals, turn, wars);
        AttackPlan plan = TargetSelector.createAttackPlan(kingdom, rivals, targets, kingdom.turns);

        ResourcePlan resources = ResourceManager.plan(kingdom, analysis);

        if (primary.action() == ActionType.ATTACK) {
            confirmDeclaration(kingdom.id, primary.targetId());
        }

        ComprehensiveDecision decision = new ComprehensiveDecision(
                kingdom.id, tick, primary, build, plan, resources, analysis,
                confidence(primary, plan, analysis),
                advice(analysis, primary, build, plan, resources, personality),
                reasoning(analysis, primary, build, plan));

        history.record(decision);
        Monarchy.LOGGER.debug("[AI] decide kingdom={} tick={} action={} priority={} target={} confidence={}",
                kingdom.id, tick, primary.action(), primary.priority(), primary.targetId(),
                String.format(Locale.US, "%.2f", decision.confidence()));
        return decision;
    }

    /** Record a performance sample and log when recent results call for a change of course. */
    public void updatePerformanceMetrics(PerformanceMetrics m) {
        history.recordMetrics(m);

        List<PerformanceMetrics> recent = history.recentMetrics(ADAPT_WINDOW);
        if (recent.size() < ADAPT_WINDOW) return;

        double attack = 0, growth = 0;
        for (PerformanceMetrics p : recent) {
            attack += p.attackSuccessRate();
            growth += p.economicGrowthRate();
        }
        attack /= recent.size();
        growth /= recent.size();

        if (attack < POOR_ATTACK_SUCCESS) {
            Monarchy.LOGGER.debug("[AI] adapting: attack success {} below {}",
                    String.format(Locale.US, "%.2f", attack), POOR_ATTACK_SUCCESS);
        }
        if (growth < SLOW_GROWTH) {
            Monarchy.LOGGER.debug("[AI] adapting: economic growth {} below {}",
                    String.format(Locale.US, "%.3f", growth), SLOW_GROWTH);
        }
    }

    // =========================
    // Pieces
    // =========================

    public static double confidence(StrategicDecision primary, AttackPlan plan, GameAnalysis analysis) {
        double c = BASE_CONFIDENCE;

        if (primary.priority() >= HIGH_PRIORITY) c += 0.2;
        if (primary.risk() == RiskLevel.LOW) c += 0.1;

        if (plan != null) {
            Recommendation r = plan.primary().recommendation();
            if (r == Recommendation.PRIME) c += 0.2;
            else if (r == Recommendation.GOOD) c += 0.1;
        }

        if (analysis.position() == GameAnalysis.Position.DOMINANT) c += 0.1;
        else if (analysis.position() == GameAnalysis.Position.CRITICAL) c -= 0.2;

        if (analysis.market() == GameAnalysis.Market.FAVORABLE) c += 0.1;
        else if (analysis.market() == GameAnalysis.Market.HOSTILE) c -= 0.1;

        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, c));
    }

    static List<String> reasoning(GameAnalysis analysis, StrategicDecision primary,
                                  BuildOrder build, AttackPlan plan) {
        List<String> out = new ArrayList<>();
        out.add("Game analysis: " + lower(analysis.phase()) + " phase with " + analysis.threats().size()
                + " threats and " + analysis.opportunities().size() + " opportunities");
        out.add("Primary action: " + primary.action().id() + " (priority " + primary.priority() + ") - "
                + String.join("; ", primary.reasoning()));
        if (!build.steps().isEmpty()) {
            out.add("Build priority: " + build.steps().get(0).description() + " ("
                    + (long) build.steps().get(0).expectedBenefit() + " expected benefit)");
        }
        if (plan != null) {
            out.add("Attack strategy: " + plan.sequence().size() + " planned attacks on " + plan.primary().targetId()
                    + " for " + plan.expectedLand() + " total land");
        }
        out.add("Strategic position: " + lower(analysis.position()) + " (rank " + analysis.rank() + " of "
                + analysis.kingdomCount() + ") in " + lower(analysis.market()) + " conditions");
        return out;
    }

    static List<String> advice(GameAnalysis analysis, StrategicDecision primary, BuildOrder build,
                               AttackPlan plan, ResourcePlan resources, Personality personality) {
        List<String> out = new ArrayList<>();
        out.add("Game phase: " + lower(analysis.phase()) + " - " + analysis.recommendation());
        if (!analysis.threats().isEmpty()) {
            out.add(analysis.threats().size() + " threats detected - keep "
                    + resources.gold().defensive().percentage() + "% of gold on defense");
        }
        if (!analysis.opportunities().isEmpty()) {
            out.add(analysis.opportunities().size() + " expansion opportunities available");
        }
        if (primary.action() == ActionType.ATTACK && plan != null) {
            out.add("Attack plan: " + plan.totalTurns() + " turns for " + plan.expectedLand() + " land");
        } else if (primary.action() == ActionType.BUILD && !build.steps().isEmpty()) {
            out.add("Build focus: " + build.steps().get(0).description());
        }
        out.addAll(RaceStrategy.strategicAdvice(personality, analysis.phase()));
        return out;
    }

    private void confirmDeclaration(String attackerId, String targetId) {
        if (!autoDeclareWar || targetId == null) return;
        if (wars.status(attackerId, targetId) != WarStatus.WAR_REQUIRED) return;
        try {
            WarDeclaration d = wars.declareWar(attackerId, targetId);
            Monarchy.LOGGER.info("[AI] {} declared war on {} after {} attacks",
                    attackerId, targetId, d.attackCount());
        } catch (IllegalStateException e) {
            // another worker moved the pair on between the status read and the declaration
            Monarchy.LOGGER.debug("[AI] declaration {} -> {} skipped: {}", attackerId, targetId, e.getMessage());
        }
    }

    private static List<Kingdom> engageable(Kingdom self, List<Kingdom> world, long tick) {
        List<Kingdom> out = new ArrayList<>(world.size());
        for (Kingdom k : world) {
            if (k.id.equals(self.id) || self.allies.contains(k.id)) continue;
            if (k.isInRestoration(tick)) continue;
            out.add(k);
        }
        return out;
    }

    private static String lower(Enum<?> e) {
        return e.name().toLowerCase(Locale.ROOT);
    }
}
