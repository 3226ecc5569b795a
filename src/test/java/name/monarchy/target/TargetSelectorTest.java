package name.monarchy.target;

import name.monarchy.kingdom.Kingdom;
import name.monarchy.kingdom.Race;
import name.monarchy.mechanics.AttackType;
import name.monarchy.war.WarState;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TargetSelectorTest {

    private static Kingdom kingdom(String id, Race race, double land, double gold) {
        Kingdom k = new Kingdom(id, id, race);
        k.land = land;
        k.gold = gold;
        return k;
    }

    private static TargetAnalysis.CombatPrediction prediction(double success, double efficiency) {
        return new TargetAnalysis.CombatPrediction(1.0, success, 10, 0, 4, efficiency, 0.15);
    }

    private static TargetAnalysis.RiskAssessment risk(boolean war) {
        return new TargetAnalysis.RiskAssessment(war, 0.5, 0.5, 0.2);
    }

    @Test
    public void recommendationThresholds() {
        assertEquals(Recommendation.PRIME, TargetSelector.recommend(75, prediction(0.95, 2.5), risk(false)));
        assertEquals(Recommendation.GOOD, TargetSelector.recommend(75, prediction(0.85, 1.0), risk(false)));
        assertEquals(Recommendation.GOOD, TargetSelector.recommend(55, prediction(0.7, 5.0), risk(false)));
        assertEquals(Recommendation.RISKY, TargetSelector.recommend(55, prediction(0.65, 5.0), risk(false)));
        assertEquals(Recommendation.RISKY, TargetSelector.recommend(30, prediction(0.95, 5.0), risk(false)));
        assertEquals(Recommendation.AVOID, TargetSelector.recommend(29.9, prediction(0.95, 5.0), risk(false)));
    }

    @Test
    public void pendingWarDeclarationOverridesScore() {
        assertEquals(Recommendation.AVOID, TargetSelector.recommend(95, prediction(0.85, 5.0), risk(true)));
        assertEquals(Recommendation.PRIME, TargetSelector.recommend(95, prediction(0.95, 5.0), risk(true)));
    }

    @Test
    public void analysesAreSortedBestFirstAndSkipSelf() {
        Kingdom me = kingdom("me", Race.DROBEN, 2000, 10_000);
        List<Kingdom> all = List.of(me,
                kingdom("small", Race.HUMAN, 500, 0),
                kingdom("peer", Race.HUMAN, 2000, 10_000),
                kingdom("fort", Race.DWARVEN, 4000, 50_000));

        List<TargetAnalysis> ranked = TargetSelector.analyzeTargets(me, all, 30, null);
        assertEquals(3, ranked.size());
        for (int i = 1; i < ranked.size(); i++) {
            assertTrue(ranked.get(i - 1).overallScore() >= ranked.get(i).overallScore());
        }
        for (TargetAnalysis a : ranked) assertNotEquals("me", a.targetId());
        assertTrue(ranked.get(0).overallScore() >= 0);
    }

    @Test
    public void racialBonusesShiftTheRatio() {
        Kingdom orc = kingdom("orc", Race.DROBEN, 1000, 0);
        Kingdom dwarf = kingdom("dwarf", Race.DWARVEN, 1000, 0);
        TargetAnalysis.CombatPrediction p = TargetSelector.predictCombat(orc, dwarf);
        assertEquals(1.2 / 1.4, p.adjustedRatio(), 1e-9);
        assertEquals(0.65, p.successProbability(), 1e-9);
    }

    @Test
    public void secondAttackFlagsDeclarationRisk() {
        Kingdom me = kingdom("me", Race.HUMAN, 1000, 0);
        Kingdom them = kingdom("them", Race.HUMAN, 1000, 0);
        WarState wars = new WarState(false, 10);
        wars.recordAttack("me", "them");
        assertFalse(TargetSelector.analyzeTargets(me, List.of(them), 10, wars).get(0).risk().warDeclarationRisk());
        wars.recordAttack("me", "them");
        assertTrue(TargetSelector.analyzeTargets(me, List.of(them), 10, wars).get(0).risk().warDeclarationRisk());
    }

    @Test
    public void planOpensWithControlledStrikeAndFitsTurns() {
        Kingdom me = kingdom("me", Race.HUMAN, 2000, 0);
        Kingdom small = kingdom("small", Race.HUMAN, 500, 0);
        List<Kingdom> all = List.of(me, small);
        List<TargetAnalysis> analyses = TargetSelector.analyzeTargets(me, all, 10, null);
        assertEquals(Recommendation.PRIME, analyses.get(0).recommendation());

        AttackPlan plan = TargetSelector.createAttackPlan(me, all, analyses, 20);
        assertNotNull(plan);
        assertEquals("small", plan.primary().targetId());
        assertEquals(AttackType.CONTROLLED_STRIKE, plan.sequence().get(0).attackType());
        assertEquals(5, plan.sequence().get(0).expectedLand());
        assertEquals(3, plan.sequence().size());
        assertEquals(18, plan.totalTurns());
        assertEquals(5 + 35 + 32, plan.expectedLand());
        assertTrue(plan.alternatives().isEmpty());
    }

    @Test
    public void noPlanWithoutCandidates() {
        Kingdom me = kingdom("me", Race.HUMAN, 1000, 0);
        List<Kingdom> alone = List.of(me);
        assertNull(TargetSelector.createAttackPlan(me, alone, TargetSelector.analyzeTargets(me, alone, 10, null), 50));
    }

    @Test
    public void strongerTargetGetsNoStrikes() {
        Kingdom me = kingdom("me", Race.HUMAN, 100, 0);
        Kingdom giant = kingdom("giant", Race.DWARVEN, 10_000, 1_000_000);
        List<Kingdom> all = List.of(me, giant);
        AttackPlan plan = TargetSelector.createAttackPlan(me, all, TargetSelector.analyzeTargets(me, all, 10, null), 50);
        if (plan != null) {
            assertTrue(plan.sequence().isEmpty());
            assertEquals(0, plan.totalTurns());
        }
    }

    @Test
    public void resourceValueCountsPopulation() {
        Kingdom k = kingdom("t", Race.HUMAN, 10, 500);
        k.population = 3;
        assertEquals(k.networth() / 100_000.0, TargetSelector.strategicValue(k, 1).resourceValue(), 1e-12);
        assertEquals(0.108, TargetSelector.strategicValue(k, 1).resourceValue(), 1e-12);
    }
}
