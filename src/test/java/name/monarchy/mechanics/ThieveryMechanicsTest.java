package name.monarchy.mechanics;

import name.monarchy.RandomSource;
import name.monarchy.kingdom.Race;
import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.*;

public class ThieveryMechanicsTest {

    @Test
    public void tooFewScumDetectNothing() {
        assertEquals(0.0, ThieveryMechanics.detectionRate(99, Race.HUMAN, 10, Race.HUMAN), 0.0);
    }

    @Test
    public void detectionIsShareOfEffectiveScum() {
        assertEquals(0.5, ThieveryMechanics.detectionRate(1000, Race.HUMAN, 1000, Race.HUMAN), 1e-9);
        assertEquals(0.95, ThieveryMechanics.detectionRate(1000, Race.HUMAN, 0, Race.HUMAN), 1e-9);
    }

    @Test
    public void detectionNeverExceedsCap() {
        Random r = new Random(42L);
        Race[] races = Race.values();
        for (int i = 0; i < 1_000; i++) {
            double d = ThieveryMechanics.detectionRate(r.nextInt(100_000), races[r.nextInt(races.length)],
                    r.nextInt(100_000), races[r.nextInt(races.length)]);
            assertTrue(d >= 0.0 && d <= ThieveryMechanics.MAX_DETECTION);
        }
    }

    @Test
    public void successfulTheftTakesTenPercentOfCash() {
        ThieveryMechanics.TheftResult t = ThieveryMechanics.theftOutcome(1000, Race.HUMAN, 1000, Race.HUMAN,
                1_000_000, RandomSource.fixed(0.0));
        assertTrue(t.success());
        assertEquals(100_000L, t.goldStolen());
        assertEquals(15, t.casualties());
    }

    @Test
    public void theftIsCappedAtBaseAmount() {
        ThieveryMechanics.TheftResult t = ThieveryMechanics.theftOutcome(1000, Race.HUMAN, 0, Race.HUMAN,
                1e9, RandomSource.fixed(0.0));
        assertEquals(3_500_000L, t.goldStolen());
    }

    @Test
    public void failedTheftCostsMoreScum() {
        ThieveryMechanics.TheftResult t = ThieveryMechanics.theftOutcome(1000, Race.HUMAN, 1000, Race.HUMAN,
                1_000_000, RandomSource.fixed(0.99));
        assertFalse(t.success());
        assertEquals(0L, t.goldStolen());
        assertEquals(50, t.casualties());
    }

    @Test
    public void eliteScumDieLess() {
        int green = ThieveryMechanics.scumCasualties(10_000, ThieveryMechanics.ScumGrade.GREEN,
                ThieveryMechanics.Operation.STEAL, Race.HUMAN);
        int elite = ThieveryMechanics.scumCasualties(10_000, ThieveryMechanics.ScumGrade.ELITE,
                ThieveryMechanics.Operation.STEAL, Race.HUMAN);
        assertTrue(elite < green);
        assertEquals(3, ThieveryMechanics.operationCost(ThieveryMechanics.Operation.STEAL));
    }

    @Test
    public void optimalScumCount() {
        assertEquals(5667, ThieveryMechanics.optimalScumCount(1000, Race.HUMAN, Race.HUMAN, 0.85));
        assertEquals(ThieveryMechanics.MINIMUM_SCUM,
                ThieveryMechanics.optimalScumCount(1000, Race.HUMAN, Race.HUMAN, 1.0));
    }

    @Test
    public void protectionScalesWithThreat() {
        ThieveryMechanics.ProtectionLevels low = ThieveryMechanics.protectionLevels(10_000, ThreatLevel.LOW, Race.HUMAN);
        ThieveryMechanics.ProtectionLevels high = ThieveryMechanics.protectionLevels(10_000, ThreatLevel.HIGH, Race.HUMAN);
        assertEquals(1000, low.minimum());
        assertTrue(high.recommended() > low.recommended());
        assertTrue(high.optimal() >= high.recommended());
    }
}
