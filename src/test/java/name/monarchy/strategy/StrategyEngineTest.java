package name.monarchy.strategy;

import name.monarchy.kingdom.GamePhase;
import name.monarchy.kingdom.Kingdom;
import name.monarchy.kingdom.Race;
import name.monarchy.kingdom.UnitType;
import name.monarchy.personality.Persona;
import name.monarchy.personality.Personality;
import name.monarchy.personality.PersonalityGenerator;
import name.monarchy.personality.Playstyle;
import name.monarchy.war.WarState;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class StrategyEngineTest {

    private static final Personality MERCHANT = new PersonalityGenerator()
            .createSpecific("me", Race.HUMAN, Persona.MERCHANT, Playstyle.BALANCED);

    private static Kingdom kingdom(String id, double land, double gold, int turns) {
        Kingdom k = new Kingdom(id, id, Race.HUMAN);
        k.land = land;
        k.gold = gold;
        k.turns = turns;
        return k;
    }

    private static StrategicDecision decision(ActionType action, int priority) {
        return new StrategicDecision(action, priority, ResourceAllocation.NONE, null, 0, RiskLevel.LOW, List.of("test"));
    }

    private static StrategyContext ctx(Kingdom self, List<Kingdom> rivals) {
        return new StrategyContext(self, MERCHANT, rivals, GamePhase.MID, null);
    }

    @Test
    public void equalPrioritiesFollowDeclarationOrder() {
        assertEquals(ActionType.ATTACK, StrategyEngine.choose(List.of(
                decision(ActionType.DEFEND, 8), decision(ActionType.ATTACK, 8))).action());
        assertEquals(ActionType.BUILD, StrategyEngine.choose(List.of(
                decision(ActionType.TRAIN, 6), decision(ActionType.BUILD, 6), decision(ActionType.DEFEND, 6))).action());
    }

    @Test
    public void higherPriorityWins() {
        assertEquals(ActionType.DEFEND, StrategyEngine.choose(List.of(
                decision(ActionType.BUILD, 5), decision(ActionType.DEFEND, 11), decision(ActionType.ATTACK, 10))).action());
    }

    @Test
    public void noCandidatesMeansWait() {
        StrategicDecision d = StrategyEngine.choose(List.of());
        assertEquals(ActionType.WAIT, d.action());
        assertFalse(d.reasoning().isEmpty());
    }

    @Test
    public void brokeKingdomWithoutThreatsWaits() {
        StrategicDecision d = StrategyEngine.decide(ctx(kingdom("me", 1000, 0, 0), List.of()));
        assertEquals(ActionType.WAIT, d.action());
    }

    @Test
    public void attacksWeakTargetWhenTurnsAllow() {
        Kingdom me = kingdom("me", 2000, 0, 10);
        Kingdom weak = kingdom("weak", 1000, 0, 0);

        StrategicDecision d = StrategyEngine.decide(ctx(me, List.of(weak)));
        assertEquals(ActionType.ATTACK, d.action());
        assertEquals("weak", d.targetId());
        assertEquals(10, d.priority());
        assertEquals(73, d.expectedLand());
        assertEquals(RiskLevel.LOW, d.risk());
    }

    @Test
    public void attackNeedsFourTurns() {
        Kingdom me = kingdom("me", 2000, 0, 3);
        Kingdom weak = kingdom("weak", 1000, 0, 0);
        for (StrategicDecision d : StrategyEngine.candidates(ctx(me, List.of(weak)))) {
            assertNotEquals(ActionType.ATTACK, d.action());
        }
    }

    @Test
    public void alliesAreNeverAttacked() {
        Kingdom me = kingdom("me", 2000, 0, 10);
        Kingdom friend = kingdom("friend", 1000, 0, 0);
        me.allies.add("friend");
        assertEquals(ActionType.WAIT, StrategyEngine.decide(ctx(me, List.of(friend))).action());
    }

    @Test
    public void warRequiredTargetIsSkippedUnlessDeclaring() {
        Kingdom me = kingdom("me", 2000, 0, 10);
        Kingdom weak = kingdom("weak", 1000, 0, 0);
        WarState wars = new WarState(false, 10);
        for (int i = 0; i < 3; i++) wars.recordAttack("me", "weak");

        StrategyContext refuse = new StrategyContext(me, MERCHANT, List.of(weak), GamePhase.MID, wars, false);
        StrategyContext declare = new StrategyContext(me, MERCHANT, List.of(weak), GamePhase.MID, wars, true);

        assertEquals(ActionType.WAIT, StrategyEngine.decide(refuse).action());
        assertEquals(ActionType.ATTACK, StrategyEngine.decide(declare).action());
    }

    @Test
    public void singleThreatTriggersDefense() {
        Kingdom me = kingdom("me", 100, 0, 0);
        Kingdom big = kingdom("big", 1000, 0, 10);

        StrategicDecision d = StrategyEngine.decide(ctx(me, List.of(big)));
        assertEquals(ActionType.DEFEND, d.action());
        assertEquals(8, d.priority());
        assertEquals(RiskLevel.MEDIUM, d.risk());
    }

    @Test
    public void severalThreatsRaiseDefensePriority() {
        Kingdom me = kingdom("me", 100, 0, 0);
        StrategicDecision d = StrategyEngine.decide(ctx(me,
                List.of(kingdom("a", 1000, 0, 10), kingdom("b", 2000, 0, 10))));
        assertEquals(ActionType.DEFEND, d.action());
        assertEquals(11, d.priority());
        assertEquals(RiskLevel.HIGH, d.risk());
        assertTrue(d.reasoning().get(1).contains("b"));
    }

    @Test
    public void rivalsWithoutTurnsAreNoThreat() {
        Kingdom me = kingdom("me", 100, 0, 0);
        assertTrue(StrategyEngine.threats(ctx(me, List.of(kingdom("big", 1000, 0, 3)))).isEmpty());
    }

    @Test
    public void thinArmyTrainsUrgently() {
        Kingdom me = kingdom("me", 1000, 500, 0);
        StrategicDecision d = StrategyEngine.decide(ctx(me, List.of()));
        assertEquals(ActionType.WAIT, d.action());

        me.gold = 2_000;
        d = StrategyEngine.decide(ctx(me, List.of()));
        assertEquals(ActionType.TRAIN, d.action());
        assertEquals(9, d.priority());
        assertEquals(20, d.allocation().unitsTrained());
    }

    @Test
    public void costsFollowLandAndArmy() {
        Kingdom k = kingdom("me", 1000, 0, 0);
        k.addUnits(UnitType.MILITIA, 500);
        assertEquals(2_500L, StrategyEngine.buildCost(k));
        assertEquals(6_000L, StrategyEngine.trainCost(k));
        assertEquals(0.5, StrategyEngine.unitsPerLand(k), 1e-9);
    }
}
