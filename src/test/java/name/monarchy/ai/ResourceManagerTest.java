package name.monarchy.ai;

import name.monarchy.build.BuildSignals;
import name.monarchy.kingdom.GamePhase;
import name.monarchy.kingdom.Kingdom;
import name.monarchy.kingdom.Race;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ResourceManagerTest {

    @Test
    public void humanEarlyGoldLeansEconomic() {
        ResourcePlan.GoldAllocation g = ResourceManager.allocateGold(10_000, Race.HUMAN, GamePhase.EARLY, 0, 0);
        assertEquals(50, g.economic().percentage());
        assertEquals(5_000L, g.economic().amount());
        assertEquals(20, g.military().percentage());
        assertEquals(15, g.defensive().percentage());
        assertEquals(10_000L, g.total());
    }

    @Test
    public void threatsShiftGoldToDefense() {
        ResourcePlan.GoldAllocation g = ResourceManager.allocateGold(10_000, Race.DROBEN, GamePhase.MID, 3, 0);
        assertEquals(15, g.economic().percentage());
        assertEquals(45, g.military().percentage());
        assertEquals(30, g.defensive().percentage());
        assertEquals(0, g.opportunity().percentage());
        assertEquals(10_000L, g.total());
    }

    @Test
    public void sharesNeverGoNegative() {
        ResourcePlan.GoldAllocation g = ResourceManager.allocateGold(10_000, Race.VAMPIRE, GamePhase.LATE, 3, 3);
        assertEquals(0, g.economic().percentage());
        assertEquals(0L, g.economic().amount());
        assertEquals(65, g.military().percentage());
    }

    @Test
    public void quietMidGameKeepsMostTurnsInReserve() {
        ResourcePlan.TurnAllocation t = ResourceManager.allocateTurns(100, GamePhase.MID, 0, 0);
        assertEquals(0, t.attacks());
        assertEquals(20, t.building());
        assertEquals(10, t.defense());
        assertEquals(5, t.scouting());
        assertEquals(65, t.reserve());
    }

    @Test
    public void earlyGameMovesAttackTurnsIntoBuilding() {
        ResourcePlan.TurnAllocation t = ResourceManager.allocateTurns(100, GamePhase.EARLY, 0, 20);
        assertEquals(42, t.attacks());
        assertEquals(38, t.building());
        assertEquals(100, t.total());
    }

    @Test
    public void turnsNeverExceedBudget() {
        for (GamePhase phase : GamePhase.values()) {
            for (int turns = 0; turns <= 60; turns += 3) {
                for (int threats = 0; threats < 8; threats++) {
                    ResourcePlan.TurnAllocation t = ResourceManager.allocateTurns(turns, phase, threats, 10);
                    assertEquals(turns, t.total());
                    assertTrue(t.defense() >= 0 && t.reserve() >= 0);
                }
            }
        }
    }

    @Test
    public void reservesGrowWithThreats() {
        Kingdom k = new Kingdom("k", "k", Race.HUMAN);
        k.gold = 10_000;
        k.turns = 50;
        ResourcePlan.Reserves r = ResourceManager.reserves(k, 2);
        assertEquals(1_800L, r.gold());
        assertEquals(6, r.turns());
    }

    @Test
    public void pressureFromGoldPerAcre() {
        Kingdom k = new Kingdom("k", "k", Race.HUMAN);
        k.land = 1000;
        k.gold = 4_000;
        assertEquals(BuildSignals.ResourcePressure.HIGH, ResourceManager.pressure(k));
        k.gold = 10_000;
        assertEquals(BuildSignals.ResourcePressure.MEDIUM, ResourceManager.pressure(k));
        k.gold = 30_000;
        assertEquals(BuildSignals.ResourcePressure.LOW, ResourceManager.pressure(k));
    }

    @Test
    public void growthProjectionCompounds() {
        Kingdom k = new Kingdom("k", "k", Race.HUMAN);
        k.land = 1000;
        k.gold = 50_000;
        k.turns = 20;
        ResourcePlan plan = ResourceManager.plan(k, GameAnalysis.of(k, List.of(k), 5));
        assertTrue(plan.growth().ratePerTurn() > 0);
        assertTrue(plan.growth().shortTerm() < plan.growth().mediumTerm());
        assertTrue(plan.growth().mediumTerm() < plan.growth().longTerm());
    }

    @Test
    public void growthStartsFromFullNetworth() {
        Kingdom k = new Kingdom("k", "k", Race.HUMAN);
        k.land = 1000;
        k.population = 10_000;
        ResourcePlan.GoldAllocation none = ResourceManager.allocateGold(0, Race.HUMAN, GamePhase.MID, 0, 0);

        ResourcePlan.Growth g = ResourceManager.projectGrowth(k, GamePhase.MID, none);
        assertEquals(0.05, g.ratePerTurn(), 1e-12);
        assertEquals((long) Math.floor(2_000_000 * Math.pow(1 + 0.05, 10)), g.shortTerm());
    }
}
