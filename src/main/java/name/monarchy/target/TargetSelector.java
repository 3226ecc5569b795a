package name.monarchy.target;

import name.monarchy.kingdom.Kingdom;
import name.monarchy.kingdom.Race;
import name.monarchy.mechanics.AttackType;
import name.monarchy.mechanics.CombatMechanics;
import name.monarchy.war.WarState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;

/**
 * Scores potential attack targets by predicted outcome, strategic value and risk.
 */
public final class TargetSelector {
    private TargetSelector() {}

    // -------------------------
    // Scoring weights (points out of ~100)
    // -------------------------
    private static final double EFFICIENCY_POINTS = 40;
    private static final double SUCCESS_POINTS = 30;
    private static final double STRATEGIC_POINTS = 15;
    private static final double RISK_POINTS = 10;
    private static final double WAR_DECLARATION_PENALTY = 20;
    private static final double EFFICIENCY_CAP = 3.0;    // acres/turn that earns full marks

    private static final int WAR_RISK_ATTACK_COUNT = 2;  // the next hit would require a declaration
    private static final double ALLIANCE_RISK = 0.3;
    private static final double OPPORTUNITY_COST = 0.2;

    private static final double FULL_STRIKE_LAND = 0.07;
    private static final double FULL_STRIKE_GOLD = 0.10;
    private static final double CONTROLLED_STRIKE_GOLD = 0.02;
    private static final double LAND_LEFT_AFTER_STRIKE = 0.93;
    private static final int MAX_ALTERNATIVES = 3;

    private record CombatBonus(double offense, double defense) {}

    private static final EnumMap<Race, CombatBonus> RACIAL = new EnumMap<>(Race.class);

    static {
        RACIAL.put(Race.HUMAN,     new CombatBonus(0.0, 0.0));
        RACIAL.put(Race.DROBEN,    new CombatBonus(0.2, 0.1));
        RACIAL.put(Race.ELVEN,     new CombatBonus(-0.1, 0.3));
        RACIAL.put(Race.GOBLIN,    new CombatBonus(0.1, -0.2));
        RACIAL.put(Race.VAMPIRE,   new CombatBonus(0.3, 0.0));
        RACIAL.put(Race.ELEMENTAL, new CombatBonus(0.1, 0.1));
        RACIAL.put(Race.CENTAUR,   new CombatBonus(0.0, 0.1));
        RACIAL.put(Race.SIDHE,     new CombatBonus(0.1, 0.2));
        RACIAL.put(Race.DWARVEN,   new CombatBonus(0.0, 0.4));
        RACIAL.put(Race.FAE,       new CombatBonus(0.15, 0.15));
    }

    // =========================
    // Analysis
    // =========================

    /**
     * Analyse every candidate except the attacker itself. Sorted by overall score, best first.
     * {@code warState} may be null, in which case no war-declaration risk is assumed.
     */
    public static List<TargetAnalysis> analyzeTargets(Kingdom attacker, List<Kingdom> candidates,
                                                      int turn, WarState warState) {
        List<TargetAnalysis> out = new ArrayList<>();
        for (Kingdom t : candidates) {
            if (t.id.equals(attacker.id)) continue;
            int attacks = warState == null ? 0 : warState.attackCount(attacker.id, t.id);
            out.add(analyze(attacker, t, turn, attacks));
        }
        out.sort(Comparator.comparingDouble(TargetAnalysis::overallScore).reversed()
                .thenComparing(TargetAnalysis::targetId));
        return out;
    }

    public static TargetAnalysis analyze(Kingdom attacker, Kingdom target, int turn, int attackCount) {
        TargetAnalysis.CombatPrediction combat = predictCombat(attacker, target);
        TargetAnalysis.StrategicValue value = strategicValue(target, turn);
        TargetAnalysis.RiskAssessment risk = assessRisk(attacker, target, attackCount);
        double score = overallScore(combat, value, risk);
        return new TargetAnalysis(target.id, combat, value, risk, score, recommend(score, combat, risk));
    }

    public static TargetAnalysis.CombatPrediction predictCombat(Kingdom attacker, Kingdom target) {
        double anw = attacker.networth();
        double tnw = target.networth();
        double nwRatio = anw / Math.max(1.0, tnw);

        CombatBonus off = bonus(attacker.race);
        CombatBonus def = bonus(target.race);
        double adjusted = nwRatio * (1 + off.offense()) / (1 + def.defense());

        double success;
        if (adjusted >= 1.5) success = 0.95;
        else if (adjusted >= 1.2) success = 0.85;
        else if (adjusted >= 0.8) success = 0.65;
        else success = 0.35;

        double landPct;
        if (adjusted >= 1.5) landPct = 0.0735;
        else if (adjusted >= 1.2) landPct = 0.070;
        else landPct = 0.0679;

        double casualty;
        if (adjusted >= 1.5) casualty = 0.05;
        else if (adjusted < 0.8) casualty = 0.30;
        else casualty = 0.15;

        int turns = CombatMechanics.turnCost(anw, tnw);
        int land = (int) Math.floor(target.land * landPct * success);
        long gold = (long) Math.floor(target.gold * 0.1 * success);
        return new TargetAnalysis.CombatPrediction(adjusted, success, land, gold, turns,
                (double) land / turns, casualty);
    }

    public static TargetAnalysis.StrategicValue strategicValue(Kingdom target, int turn) {
        double growth = target.networth() / Math.max(1, turn);
        double military = target.totalUnits();
        double resources = target.land + target.gold / 1000.0;

        double threat = (Math.min(growth / 5000.0, 1.0)
                + Math.min(military / 2000.0, 1.0)
                + Math.min(resources / 2000.0, 1.0)) / 3.0;
        double resourceValue = target.networth() / 100_000.0;
        double position = target.land > 1000 ? 0.8 : 0.5;
        return new TargetAnalysis.StrategicValue(threat, resourceValue, position, ALLIANCE_RISK);
    }

    public static TargetAnalysis.RiskAssessment assessRisk(Kingdom attacker, Kingdom target, int attackCount) {
        double anw = Math.max(1.0, attacker.networth());
        double tnw = Math.max(0.0, target.networth());
        return new TargetAnalysis.RiskAssessment(
                attackCount >= WAR_RISK_ATTACK_COUNT,
                Math.min(tnw / anw, 1.0),
                1.0 - anw / (anw + tnw),
                OPPORTUNITY_COST
        );
    }

    public static double overallScore(TargetAnalysis.CombatPrediction c,
                                      TargetAnalysis.StrategicValue v,
                                      TargetAnalysis.RiskAssessment r) {
        double score = Math.min(c.efficiency() / EFFICIENCY_CAP, 1.0) * EFFICIENCY_POINTS
                + c.successProbability() * SUCCESS_POINTS
                + (v.threatLevel() + v.resourceValue()) * STRATEGIC_POINTS
                - (r.retaliationRisk() + r.lossRisk()) * RISK_POINTS;
        if (r.warDeclarationRisk() && c.successProbability() < 0.9) {
            score -= WAR_DECLARATION_PENALTY;
        }
        return Math.max(0.0, score);
    }

    public static Recommendation recommend(double score, TargetAnalysis.CombatPrediction c,
                                           TargetAnalysis.RiskAssessment r) {
        if (r.warDeclarationRisk() && c.successProbability() < 0.9) return Recommendation.AVOID;
        if (score >= 70 && c.efficiency() >= 2) return Recommendation.PRIME;
        if (score >= 50 && c.successProbability() >= 0.7) return Recommendation.GOOD;
        if (score >= 30) return Recommendation.RISKY;
        return Recommendation.AVOID;
    }

    // =========================
    // Planning
    // =========================

    /**
     * Best prime target, else best good target, plus up to three alternatives. Null when
     * nothing is worth attacking. Works on a copy of the target's land; nothing is mutated.
     */
    public static AttackPlan createAttackPlan(Kingdom attacker, List<Kingdom> kingdoms,
                                              List<TargetAnalysis> analyses, int availableTurns) {
        List<TargetAnalysis> ranked = new ArrayList<>();
        for (TargetAnalysis a : analyses) if (a.recommendation() == Recommendation.PRIME) ranked.add(a);
        for (TargetAnalysis a : analyses) if (a.recommendation() == Recommendation.GOOD) ranked.add(a);
        if (ranked.isEmpty()) return null;

        TargetAnalysis primary = ranked.get(0);
        List<TargetAnalysis> alternatives = ranked.subList(1, Math.min(ranked.size(), 1 + MAX_ALTERNATIVES));

        Kingdom target = null;
        for (Kingdom k : kingdoms) if (k.id.equals(primary.targetId())) { target = k; break; }
        if (target == null) return null;

        double anw = attacker.networth();
        double ratio = anw / Math.max(1.0, target.networth());
        int turns = availableTurns;
        double land = target.land;
        double gold = target.gold;

        List<AttackPlan.Step> steps = new ArrayList<>();
        int cost = CombatMechanics.turnCost(anw, target.networth());

        if (turns >= cost && ratio >= 1.2) {
            steps.add(new AttackPlan.Step(target.id, AttackType.CONTROLLED_STRIKE, cost,
                    CombatMechanics.controlledStrikeLand(land, 100),
                    (long) Math.floor(gold * CONTROLLED_STRIKE_GOLD)));
            turns -= cost;
        }
        while (turns >= cost && ratio >= 1.3) {
            steps.add(new AttackPlan.Step(target.id, AttackType.STANDARD, cost,
                    (int) Math.floor(land * FULL_STRIKE_LAND),
                    (long) Math.floor(gold * FULL_STRIKE_GOLD)));
            turns -= cost;
            land = Math.floor(land * LAND_LEFT_AFTER_STRIKE);
        }

        int totalTurns = 0, totalLand = 0;
        long totalGold = 0;
        for (AttackPlan.Step s : steps) {
            totalTurns += s.turnCost();
            totalLand += s.expectedLand();
            totalGold += s.expectedGold();
        }
        return new AttackPlan(primary, alternatives, steps, totalTurns, totalLand, totalGold);
    }

    private static CombatBonus bonus(Race race) {
        return RACIAL.getOrDefault(race, new CombatBonus(0, 0));
    }
}
