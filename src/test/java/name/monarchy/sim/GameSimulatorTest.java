package name.monarchy.sim;

import name.monarchy.EngineConfig;
import name.monarchy.InvalidInputException;
import name.monarchy.kingdom.Kingdom;
import name.monarchy.kingdom.Race;
import name.monarchy.kingdom.UnitType;
import name.monarchy.mechanics.Formation;
import name.monarchy.personality.Traits;
import name.monarchy.war.WarStatus;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GameSimulatorTest {

    private static EngineConfig smallGame() {
        EngineConfig c = EngineConfig.defaults();
        c.kingdomsPerGame = 3;
        c.maxTurns = 25;
        return c;
    }

    @Test
    public void gameFinishesWithAWinner() {
        GameResult r = new GameSimulator(smallGame()).play(0, 7L);

        assertTrue(r.turnsPlayed() >= 1 && r.turnsPlayed() <= 25);
        assertEquals(r.turnsPlayed(), r.turns().size());
        assertEquals(3, r.start().size());
        assertEquals(3, r.end().size());
        assertNotNull(r.condition());
        if (r.condition() != GameResult.WinCondition.LAST_STANDING) {
            assertNotNull(r.winnerId());
            assertNotNull(r.winnerRace());
        }
    }

    @Test
    public void sameSeedReplaysTheSameGame() {
        GameResult a = new GameSimulator(smallGame()).play(0, 99L);
        GameResult b = new GameSimulator(smallGame()).play(0, 99L);

        assertEquals(a.winnerId(), b.winnerId());
        assertEquals(a.condition(), b.condition());
        assertEquals(a.turnsPlayed(), b.turnsPlayed());
        assertEquals(a.end(), b.end());
        assertEquals(a.turns(), b.turns());
    }

    @Test
    public void turnCountersAddUp() {
        GameResult r = new GameSimulator(smallGame()).play(1, 123L);
        for (TurnSummary t : r.turns()) {
            assertTrue(t.battles() + t.rejected() == t.attacks());
            assertTrue(t.victories() <= t.battles());
            assertTrue(t.alive() >= 0 && t.alive() <= 3);
        }
    }

    @Test
    public void setupBuildsConfiguredKingdoms() {
        EngineConfig c = smallGame();
        World w = new GameSimulator(c).setup(5L);
        List<Kingdom> ks = w.kingdoms();

        assertEquals(3, ks.size());
        assertEquals("k1", ks.get(0).id);
        for (Kingdom k : ks) {
            assertEquals(c.startingLand, k.land, 0.0);
            assertEquals(c.startingKnights, k.unitCount(UnitType.KNIGHT));
            assertTrue(k.criticalBuildings.contains("palace"));
            assertEquals(w.personalities.cached(k.id).fullName(), k.name);
        }
    }

    @Test
    public void dominanceNeedsThreeToOneOverEveryone() {
        Kingdom big = land("big", 3000);
        assertEquals("big", GameSimulator.dominant(List.of(big, land("a", 1000), land("b", 900))));
        assertNull(GameSimulator.dominant(List.of(big, land("a", 1000), land("b", 1001))));
        assertEquals("big", GameSimulator.richest(List.of(land("a", 1000), big)));
        assertNull(GameSimulator.richest(List.of()));
    }

    @Test
    public void formationFollowsArmyAndTemper() {
        Kingdom k = land("k", 1000);
        k.addUnits(UnitType.CAVALRY, 100);
        k.addUnits(UnitType.MILITIA, 100);
        assertEquals(Formation.CAVALRY_CHARGE, GameSimulator.formationFor(Traits.NEUTRAL, k));

        k.setUnits(UnitType.CAVALRY, 0);
        assertEquals(Formation.BALANCED, GameSimulator.formationFor(Traits.NEUTRAL, k));
        assertEquals(Formation.AGGRESSIVE,
                GameSimulator.formationFor(new Traits(2, 1, 1, 1, 1, 1, 1, 1), k));
        assertEquals(Formation.DEFENSIVE,
                GameSimulator.formationFor(new Traits(1, 1, 1, 1, 0.5, 1, 1, 1), k));
    }

    @Test
    public void removingAKingdomClearsItsWars() {
        World w = new World(smallGame(), 1L);
        w.addKingdom(land("a", 1000));
        w.addKingdom(land("b", 1000));
        w.wars.recordAttack("a", "b");

        assertNotNull(w.remove("b"));
        assertEquals(1, w.size());
        assertEquals(WarStatus.NEUTRAL, w.wars.status("a", "b"));
        assertNull(w.remove("b"));
    }

    @Test(expected = InvalidInputException.class)
    public void duplicateKingdomIdsAreRejected() {
        World w = new World(smallGame(), 1L);
        w.addKingdom(land("a", 1000));
        w.addKingdom(land("a", 500));
    }

    private static Kingdom land(String id, double land) {
        Kingdom k = new Kingdom(id, id, Race.HUMAN);
        k.land = land;
        return k;
    }
}
