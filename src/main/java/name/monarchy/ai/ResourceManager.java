package name.monarchy.ai;

import name.monarchy.build.BuildSignals;
import name.monarchy.kingdom.GamePhase;
import name.monarchy.kingdom.Kingdom;
import name.monarchy.kingdom.Race;

import java.util.EnumMap;

/**
 * Splits a kingdom's gold and turns across spending categories for the current phase.
 */
public final class ResourceManager {
    private ResourceManager() {}

    // -------------------------
    // Policy knobs
    // -------------------------
    private static final int CROWDED = 2;           // more than this many threats/opportunities shifts the split
    private static final double GOLD_RESERVE = 0.15;
    private static final double TURN_RESERVE = 0.10;
    private static final double RESERVE_PER_THREAT = 0.10;

    private static final double BASE_GROWTH = 0.05;
    private static final double ECONOMIC_GROWTH_WEIGHT = 0.10;
    private static final double MILITARY_GROWTH_WEIGHT = 0.05;

    /** Gold on hand per acre below which the treasury counts as strained. */
    private static final double HIGH_PRESSURE_GOLD_PER_ACRE = 5.0;
    private static final double MEDIUM_PRESSURE_GOLD_PER_ACRE = 25.0;

    private record Split(int economic, int military, int defensive, int emergency, int opportunity) {}

    private record RacialBias(double economy, double military) {}

    private static final EnumMap<GamePhase, Split> BASE = new EnumMap<>(GamePhase.class);
    private static final EnumMap<Race, RacialBias> RACIAL = new EnumMap<>(Race.class);

    static {
        BASE.put(GamePhase.EARLY, new Split(45, 25, 15, 10, 5));
        BASE.put(GamePhase.MID,   new Split(30, 35, 20, 10, 5));
        BASE.put(GamePhase.LATE,  new Split(20, 45, 20, 10, 5));

        RACIAL.put(Race.HUMAN,     new RacialBias(0.2, 0.0));
        RACIAL.put(Race.DROBEN,    new RacialBias(-0.1, 0.3));
        RACIAL.put(Race.ELVEN,     new RacialBias(0.0, 0.1));
        RACIAL.put(Race.GOBLIN,    new RacialBias(-0.1, 0.2));
        RACIAL.put(Race.VAMPIRE,   new RacialBias(-0.2, 0.4));
        RACIAL.put(Race.ELEMENTAL, new RacialBias(0.1, 0.1));
        RACIAL.put(Race.CENTAUR,   new RacialBias(0.0, 0.0));
        RACIAL.put(Race.SIDHE,     new RacialBias(0.1, 0.2));
        RACIAL.put(Race.DWARVEN,   new RacialBias(0.1, 0.0));
        RACIAL.put(Race.FAE,       new RacialBias(0.15, 0.15));
    }

    public static ResourcePlan plan(Kingdom k, GameAnalysis analysis) {
        int threats = analysis.threats().size();
        int opportunities = analysis.opportunities().size();
        ResourcePlan.GoldAllocation gold = allocateGold(k.gold, k.race, analysis.phase(), threats, opportunities);
        return new ResourcePlan(
                gold,
                allocateTurns(k.turns, analysis.phase(), threats, opportunities),
                reserves(k, threats),
                projectGrowth(k, analysis.phase(), gold)
        );
    }

    public static ResourcePlan.GoldAllocation allocateGold(double totalGold, Race race, GamePhase phase,
                                                           int threats, int opportunities) {
        Split s = BASE.get(phase);
        int eco = s.economic(), mil = s.military(), def = s.defensive(), emg = s.emergency(), opp = s.opportunity();

        if (threats > CROWDED) {
            def += 10; mil += 5; eco -= 10; opp -= 5;
        }
        if (opportunities > CROWDED) {
            mil += 10; opp += 5; eco -= 10; def -= 5;
        }

        RacialBias bias = RACIAL.getOrDefault(race, RACIAL.get(Race.HUMAN));
        if (bias.economy() > 0) { eco += 5; mil -= 5; }
        if (bias.military() > 0) { mil += 5; eco -= 5; }

        return new ResourcePlan.GoldAllocation(
                share(totalGold, eco), share(totalGold, mil), share(totalGold, def),
                share(totalGold, emg), share(totalGold, opp));
    }

    public static ResourcePlan.TurnAllocation allocateTurns(int totalTurns, GamePhase phase,
                                                            int threats, int opportunities) {
        int attack = Math.min((int) Math.floor(totalTurns * 0.6), opportunities * 4);
        int build = (int) Math.floor(totalTurns * 0.2);
        int defense = Math.max((int) Math.floor(totalTurns * 0.1), threats * 2);
        int scouting = (int) Math.floor(totalTurns * 0.05);

        if (phase == GamePhase.EARLY) {
            build += (int) Math.floor(attack * 0.3);
            attack = (int) Math.floor(attack * 0.7);
        } else if (phase == GamePhase.LATE) {
            attack += (int) Math.floor(build * 0.5);
            build = (int) Math.floor(build * 0.5);
        }

        // threats can push defense past the budget; trim it so the parts never exceed the whole
        defense = Math.min(defense, Math.max(0, totalTurns - attack - build - scouting));
        int reserve = Math.max(0, totalTurns - attack - build - defense - scouting);
        return new ResourcePlan.TurnAllocation(attack, build, defense, scouting, reserve);
    }

    public static ResourcePlan.Reserves reserves(Kingdom k, int threats) {
        double m = 1.0 + threats * RESERVE_PER_THREAT;
        long gold = (long) Math.floor(Math.floor(k.gold * GOLD_RESERVE) * m);
        int turns = (int) Math.floor(Math.floor(k.turns * TURN_RESERVE) * m);
        return new ResourcePlan.Reserves(Math.min(gold, (long) k.gold), Math.min(turns, k.turns));
    }

    public static ResourcePlan.Growth projectGrowth(Kingdom k, GamePhase phase, ResourcePlan.GoldAllocation gold) {
        double nw = Math.max(1.0, k.networth());
        double phaseMul = switch (phase) {
            case EARLY -> 1.2;
            case MID -> 1.0;
            case LATE -> 0.8;
        };
        double rate = (BASE_GROWTH
                + gold.economic().amount() / nw * ECONOMIC_GROWTH_WEIGHT
                + gold.military().amount() / nw * MILITARY_GROWTH_WEIGHT) * phaseMul;
        return new ResourcePlan.Growth(rate,
                (long) Math.floor(nw * Math.pow(1 + rate, 10)),
                (long) Math.floor(nw * Math.pow(1 + rate * 0.9, 25)),
                (long) Math.floor(nw * Math.pow(1 + rate * 0.7, 50)));
    }

    public static BuildSignals.ResourcePressure pressure(Kingdom k) {
        double perAcre = k.gold / Math.max(1.0, k.land);
        if (perAcre < HIGH_PRESSURE_GOLD_PER_ACRE) return BuildSignals.ResourcePressure.HIGH;
        if (perAcre < MEDIUM_PRESSURE_GOLD_PER_ACRE) return BuildSignals.ResourcePressure.MEDIUM;
        return BuildSignals.ResourcePressure.LOW;
    }

    private static ResourcePlan.Share share(double total, int pct) {
        int p = Math.max(0, pct);
        return new ResourcePlan.Share((long) Math.floor(Math.max(0.0, total) * p / 100.0), p);
    }
}
