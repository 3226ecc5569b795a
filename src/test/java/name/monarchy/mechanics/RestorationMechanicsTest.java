package name.monarchy.mechanics;

import org.junit.Test;

import java.util.Set;

import static name.monarchy.mechanics.RestorationMechanics.*;
import static org.junit.Assert.*;

public class RestorationMechanicsTest {

    private static DamageSnapshot snap(double structures, double population, String... critical) {
        return new DamageSnapshot(structures, population, Set.of(critical));
    }

    @Test
    public void heavyStructureLossQualifies() {
        Assessment a = restorationQualifies(snap(100, 1000, "palace"), snap(25, 900, "palace"));
        assertEquals(RestorationType.DAMAGE_BASED, a.type());
        assertEquals(48, a.protectionHours());
        assertEquals(0.75, a.structureLoss(), 1e-9);
    }

    @Test
    public void populationLossQualifies() {
        Assessment a = restorationQualifies(snap(100, 1000), snap(90, 150));
        assertEquals(RestorationType.DAMAGE_BASED, a.type());
    }

    @Test
    public void losingThePalaceQualifies() {
        Assessment a = restorationQualifies(snap(100, 1000, "palace"), snap(95, 990));
        assertTrue(a.criticalInfrastructureDestroyed());
        assertTrue(a.qualifies());
    }

    @Test
    public void nonCriticalBuildingsDoNotCount() {
        Assessment a = restorationQualifies(snap(100, 1000, "barn"), snap(95, 990));
        assertFalse(a.criticalInfrastructureDestroyed());
        assertFalse(a.qualifies());
        assertEquals(0, a.protectionHours());
    }

    @Test
    public void wipedOutIsDeathBased() {
        assertEquals(RestorationType.DEATH_BASED, restorationQualifies(snap(100, 1000), snap(0, 500)).type());
        assertEquals(72, restorationQualifies(snap(100, 1000), snap(50, 0)).protectionHours());
    }

    @Test
    public void everyHostileActionIsProhibited() {
        for (ProhibitedAction a : ProhibitedAction.values()) {
            assertTrue(isProhibited(a));
        }
        assertFalse(isProhibited(null));
    }
}
