package name.monarchy.kingdom;

import name.monarchy.InvalidInputException;
import org.junit.Test;

import static org.junit.Assert.*;

public class KingdomTest {

    @Test
    public void networthWeighsLandGoldAndPeople() {
        Kingdom k = new Kingdom("k", null, Race.HUMAN);
        k.land = 10;
        k.gold = 500;
        k.population = 3;
        assertEquals(10 * 1000 + 500 + 300, k.networth(), 1e-9);
        assertEquals("k", k.name);
    }

    @Test
    public void zeroUnitsDropTheStack() {
        Kingdom k = new Kingdom("k", "K", Race.HUMAN);
        k.addUnits(UnitType.KNIGHT, 5);
        k.addUnits(UnitType.KNIGHT, -5);
        assertFalse(k.units.containsKey(UnitType.KNIGHT));
        assertEquals(0, k.totalUnits());
        assertTrue(k.unitStacks().isEmpty());
    }

    @Test
    public void copyDoesNotShareState() {
        Kingdom k = new Kingdom("k", "K", Race.DWARVEN);
        k.land = 100;
        k.addUnits(UnitType.MILITIA, 10);
        k.allies.add("friend");

        Kingdom c = k.copy();
        c.land = 1;
        c.addUnits(UnitType.MILITIA, 5);
        c.allies.clear();

        assertEquals(100, k.land, 0.0);
        assertEquals(10, k.unitCount(UnitType.MILITIA));
        assertTrue(k.allies.contains("friend"));
    }

    @Test
    public void restorationEndsAtItsTick() {
        Kingdom k = new Kingdom("k", "K", Race.HUMAN);
        assertFalse(k.isInRestoration(0));
        k.restorationUntil = 50;
        assertTrue(k.isInRestoration(49));
        assertFalse(k.isInRestoration(50));
    }

    @Test(expected = InvalidInputException.class)
    public void infiniteGoldIsRejected() {
        Kingdom k = new Kingdom("k", "K", Race.HUMAN);
        k.gold = Double.POSITIVE_INFINITY;
        k.validate();
    }

    @Test(expected = InvalidInputException.class)
    public void negativeTurnsAreRejected() {
        Kingdom k = new Kingdom("k", "K", Race.HUMAN);
        k.turns = -1;
        k.validate();
    }
}
