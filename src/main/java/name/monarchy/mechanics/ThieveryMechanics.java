package name.monarchy.mechanics;

import name.monarchy.RandomSource;
import name.monarchy.kingdom.Race;

import java.util.EnumMap;

public final class ThieveryMechanics {
    private ThieveryMechanics() {}

    // -------------------------
    // Policy knobs
    // -------------------------
    public static final int MINIMUM_SCUM = 100;             // below this nothing is detected
    public static final double MAX_DETECTION = 0.95;
    public static final double OPTIMAL_DETECTION = 0.85;

    public static final double BASE_THEFT_AMOUNT = 3_500_000;
    public static final double MAX_THEFT_SHARE = 0.10;      // of target cash
    public static final double SUCCESS_CASUALTIES = 0.015;
    public static final double FAILURE_CASUALTIES = 0.05;

    private static final double GREEN_DEATH_RATE = (0.01 + 0.025) / 2.0;
    private static final double ELITE_DEATH_RATE = (0.0088 + 0.0094) / 2.0;

    public enum Operation {
        SCOUT(2, 0.5),
        STEAL(3, 1.0),
        SABOTAGE(3, 1.2),
        INTERCEPT(2, 0.8),
        BURN(4, 1.5),
        DESECRATE(3, 1.0);

        public final int turnCost;
        public final double casualtyMultiplier;

        Operation(int turnCost, double casualtyMultiplier) {
            this.turnCost = turnCost;
            this.casualtyMultiplier = casualtyMultiplier;
        }
    }

    public enum ScumGrade { GREEN, ELITE }

    private record RacialScum(double effectiveness, double survivalRate) {}

    private static final EnumMap<Race, RacialScum> RACIAL = new EnumMap<>(Race.class);

    static {
        RACIAL.put(Race.CENTAUR,   new RacialScum(1.005, 1.0));
        RACIAL.put(Race.HUMAN,     new RacialScum(1.0,   1.0));
        RACIAL.put(Race.VAMPIRE,   new RacialScum(1.0,   1.1));
        RACIAL.put(Race.SIDHE,     new RacialScum(1.0,   1.0));
        RACIAL.put(Race.ELVEN,     new RacialScum(0.9,   1.0));
        RACIAL.put(Race.GOBLIN,    new RacialScum(0.8,   0.9));
        RACIAL.put(Race.DWARVEN,   new RacialScum(0.8,   0.9));
        RACIAL.put(Race.DROBEN,    new RacialScum(0.75,  0.85));
        RACIAL.put(Race.ELEMENTAL, new RacialScum(0.85,  0.9));
        RACIAL.put(Race.FAE,       new RacialScum(0.95,  0.95));
    }

    public static double effectiveness(Race race) {
        RacialScum r = race == null ? null : RACIAL.get(race);
        return r == null ? 1.0 : r.effectiveness();
    }

    public static double survivalRate(Race race) {
        RacialScum r = race == null ? null : RACIAL.get(race);
        return r == null ? 1.0 : r.survivalRate();
    }

    // =========================
    // Detection and theft
    // =========================

    /**
     * Chance that {@code own} scum detect an enemy operation. Zero below {@link #MINIMUM_SCUM},
     * never above {@link #MAX_DETECTION}.
     */
    public static double detectionRate(int ownScum, Race ownRace, int enemyScum, Race enemyRace) {
        if (ownScum < MINIMUM_SCUM) return 0.0;

        double own = ownScum * effectiveness(ownRace);
        double enemy = Math.max(0, enemyScum) * effectiveness(enemyRace);
        double total = own + enemy;
        if (total <= 0) return 0.0;
        return Math.min(MAX_DETECTION, own / total);
    }

    public record TheftResult(boolean success, long goldStolen, int casualties, double detectionRate) {}

    public static TheftResult theftOutcome(int attackerScum, Race attackerRace,
                                           int defenderScum, Race defenderRace,
                                           double targetGold, RandomSource rng) {
        double detection = detectionRate(defenderScum, defenderRace, attackerScum, attackerRace);
        double successChance = 1.0 - detection;

        if (rng.nextDouble() > successChance) {
            int lost = (int) Math.floor(Math.max(0, attackerScum) * FAILURE_CASUALTIES);
            return new TheftResult(false, 0, lost, detection);
        }

        double stolen = Math.min(BASE_THEFT_AMOUNT, Math.max(0, targetGold) * MAX_THEFT_SHARE);
        int lost = (int) Math.floor(Math.max(0, attackerScum) * SUCCESS_CASUALTIES);
        return new TheftResult(true, (long) Math.floor(stolen), lost, detection);
    }

    // =========================
    // Planning helpers
    // =========================

    public static int operationCost(Operation op) {
        return op.turnCost;
    }

    public static int scumCasualties(int scumCount, ScumGrade grade, Operation op, Race race) {
        double base = grade == ScumGrade.ELITE ? ELITE_DEATH_RATE : GREEN_DEATH_RATE;
        double rate = base / survivalRate(race) * op.casualtyMultiplier;
        return (int) Math.floor(Math.max(0, scumCount) * rate);
    }

    /** Scum needed to detect an expected enemy force at the target rate. */
    public static int optimalScumCount(int expectedEnemyScum, Race enemyRace, Race ownRace, double targetDetection) {
        double denominator = effectiveness(ownRace) * (1.0 - targetDetection);
        if (denominator <= 0) return MINIMUM_SCUM;
        double required = expectedEnemyScum * effectiveness(enemyRace) * targetDetection / denominator;
        return Math.max(MINIMUM_SCUM, (int) Math.ceil(required));
    }

    public record ProtectionLevels(int minimum, int recommended, int optimal) {}

    public static ProtectionLevels protectionLevels(double totalLand, ThreatLevel threat, Race race) {
        double base = switch (threat) {
            case LOW -> 0.1;
            case MEDIUM -> 0.4;
            case HIGH -> 0.8;
        };
        double ratio = base / effectiveness(race);
        return new ProtectionLevels(
                Math.max(MINIMUM_SCUM, (int) Math.floor(totalLand * 0.1)),
                (int) Math.floor(totalLand * ratio),
                (int) Math.floor(totalLand * ratio * 1.2)
        );
    }
}
