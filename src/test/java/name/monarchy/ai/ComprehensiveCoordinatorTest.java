package name.monarchy.ai;

import name.monarchy.InvalidInputException;
import name.monarchy.kingdom.Kingdom;
import name.monarchy.kingdom.Race;
import name.monarchy.kingdom.UnitType;
import name.monarchy.personality.PersonalityGenerator;
import name.monarchy.strategy.ActionType;
import name.monarchy.strategy.StrategicDecision;
import name.monarchy.war.WarState;
import name.monarchy.war.WarStatus;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.Assert.*;

public class ComprehensiveCoordinatorTest {

    private static Kingdom kingdom(String id, double land, double gold, int turns) {
        Kingdom k = new Kingdom(id, id, Race.HUMAN);
        k.land = land;
        k.gold = gold;
        k.turns = turns;
        return k;
    }

    private static ComprehensiveCoordinator coordinator(WarState wars, boolean autoDeclare) {
        return new ComprehensiveCoordinator(new PersonalityGenerator(), wars, new DecisionHistory(50, 100), autoDeclare);
    }

    @Test
    public void strongKingdomAttacksWeakNeighbour() {
        Kingdom me = kingdom("me", 2000, 0, 20);
        Kingdom weak = kingdom("weak", 1000, 0, 0);
        ComprehensiveCoordinator c = coordinator(new WarState(false, 10), false);

        ComprehensiveDecision d = c.makeDecision(me, List.of(me, weak), 30);
        assertEquals(ActionType.ATTACK, d.primary().action());
        assertEquals("weak", d.primary().targetId());
        assertNotNull(d.attackPlan());
        assertFalse(d.reasoning().isEmpty());
        assertTrue(d.reasoning().get(0).startsWith("Game analysis"));
        assertFalse(d.advice().isEmpty());
        assertEquals(1, c.history().decisions("me").size());
    }

    @Test
    public void decisionsDoNotMutateKingdoms() {
        Kingdom me = kingdom("me", 2000, 5_000, 20);
        me.addUnits(UnitType.KNIGHT, 100);
        Kingdom weak = kingdom("weak", 1000, 300, 0);

        coordinator(new WarState(false, 10), false).makeDecision(me, List.of(me, weak), 30);
        assertEquals(2000, me.land, 0.0);
        assertEquals(5_000, me.gold, 0.0);
        assertEquals(20, me.turns);
        assertEquals(100, me.unitCount(UnitType.KNIGHT));
        assertEquals(1000, weak.land, 0.0);
    }

    @Test
    public void autoDeclarationTurnsWarRequiredIntoWar() {
        Kingdom me = kingdom("me", 2000, 0, 20);
        Kingdom weak = kingdom("weak", 1000, 0, 0);
        WarState wars = new WarState(false, 10);
        for (int i = 0; i < 3; i++) wars.recordAttack("me", "weak");

        ComprehensiveDecision d = coordinator(wars, true).makeDecision(me, List.of(me, weak), 30);
        assertEquals(ActionType.ATTACK, d.primary().action());
        assertEquals(WarStatus.AT_WAR, wars.status("me", "weak"));
        assertTrue(wars.canAttack("me", "weak").allowed());
    }

    @Test
    public void withoutAutoDeclarationRequiredTargetIsLeftAlone() {
        Kingdom me = kingdom("me", 2000, 0, 20);
        Kingdom weak = kingdom("weak", 1000, 0, 0);
        WarState wars = new WarState(false, 10);
        for (int i = 0; i < 3; i++) wars.recordAttack("me", "weak");

        ComprehensiveDecision d = coordinator(wars, false).makeDecision(me, List.of(me, weak), 30);
        assertNotEquals(ActionType.ATTACK, d.primary().action());
        assertEquals(WarStatus.WAR_REQUIRED, wars.status("me", "weak"));
    }

    @Test
    public void restorationBlocksBothDirections() {
        Kingdom me = kingdom("me", 2000, 0, 20);
        Kingdom weak = kingdom("weak", 1000, 0, 0);
        ComprehensiveCoordinator c = coordinator(new WarState(false, 10), false);

        weak.restorationUntil = 100;
        assertEquals(ActionType.WAIT, c.makeDecision(me, List.of(me, weak), 30).primary().action());

        weak.restorationUntil = -1;
        me.restorationUntil = 100;
        ComprehensiveDecision d = c.makeDecision(me, List.of(me, weak), 30);
        assertEquals(ActionType.WAIT, d.primary().action());
        assertNull(d.attackPlan());

        assertEquals(ActionType.ATTACK, c.makeDecision(me, List.of(me, weak), 100).primary().action());
    }

    @Test
    public void confidenceStaysInBounds() {
        Random r = new Random(42L);
        ComprehensiveCoordinator c = coordinator(new WarState(false, 10), false);
        for (int round = 0; round < 40; round++) {
            List<Kingdom> world = new ArrayList<>();
            for (int i = 0; i < 2 + r.nextInt(6); i++) {
                Kingdom k = new Kingdom("k" + round + "_" + i, null, Race.values()[r.nextInt(Race.values().length)]);
                k.land = 100 + r.nextInt(5000);
                k.gold = r.nextInt(200_000);
                k.turns = r.nextInt(40);
                k.population = r.nextInt(10_000);
                k.addUnits(UnitType.INFANTRY, r.nextInt(3000));
                world.add(k);
            }
            for (Kingdom k : world) {
                ComprehensiveDecision d = c.makeDecision(k, world, r.nextInt(120));
                assertTrue(d.confidence() >= 0.1 && d.confidence() <= 1.0);
                assertFalse(d.reasoning().isEmpty());
                assertFalse(d.primary().reasoning().isEmpty());
            }
        }
    }

    @Test
    public void crippledKingdomHasLowConfidence() {
        Kingdom me = kingdom("me", 100, 0, 0);
        List<Kingdom> world = List.of(me, kingdom("a", 1000, 0, 0), kingdom("b", 2000, 0, 0), kingdom("c", 3000, 0, 0));
        GameAnalysis a = GameAnalysis.of(me, world, 30);
        assertEquals(GameAnalysis.Position.CRITICAL, a.position());
        assertEquals(GameAnalysis.Market.HOSTILE, a.market());

        StrategicDecision wait = StrategicDecision.waitTurn("nothing to do");
        assertEquals(0.3, ComprehensiveCoordinator.confidence(wait, null, a), 1e-9);
    }

    @Test(expected = InvalidInputException.class)
    public void corruptSnapshotIsRejected() {
        Kingdom me = kingdom("me", 1000, 0, 10);
        Kingdom bad = kingdom("bad", Double.NaN, 0, 0);
        coordinator(new WarState(false, 10), false).makeDecision(me, List.of(me, bad), 1);
    }

    // -------------------------
    // History
    // -------------------------

    @Test
    public void historyKeepsOnlyNewestDecisions() {
        DecisionHistory history = new DecisionHistory(3, 5);
        ComprehensiveCoordinator c = new ComprehensiveCoordinator(new PersonalityGenerator(),
                new WarState(false, 10), history, false);
        Kingdom me = kingdom("me", 1000, 0, 0);
        for (int tick = 1; tick <= 5; tick++) c.makeDecision(me, List.of(me), tick);

        List<ComprehensiveDecision> kept = history.decisions("me");
        assertEquals(3, kept.size());
        assertEquals(3L, kept.get(0).tick());
        assertEquals(5L, kept.get(2).tick());

        Map<ActionType, Integer> dist = history.actionDistribution("me");
        assertEquals(Integer.valueOf(3), dist.get(ActionType.WAIT));
        assertTrue(history.averageConfidence("me") > 0);

        history.forget("me");
        assertTrue(history.decisions("me").isEmpty());
        assertEquals(0.0, history.averageConfidence("me"), 0.0);
    }

    @Test
    public void metricsRingIsBounded() {
        DecisionHistory history = new DecisionHistory(3, 5);
        ComprehensiveCoordinator c = new ComprehensiveCoordinator(new PersonalityGenerator(),
                new WarState(false, 10), history, false);
        for (int i = 0; i < 12; i++) {
            c.updatePerformanceMetrics(new PerformanceMetrics("me", i, 0.4, 1, 0.01, 1, 0));
        }
        assertEquals(5, history.metrics().size());
        assertEquals(7L, history.metrics().get(0).tick());
        assertEquals(2, history.recentMetrics(2).size());
        assertEquals(11L, history.recentMetrics(2).get(1).tick());
    }
}
