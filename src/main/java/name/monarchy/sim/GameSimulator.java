package name.monarchy.sim;

import name.monarchy.EngineConfig;
import name.monarchy.InvalidInputException;
import name.monarchy.Monarchy;
import name.monarchy.ai.ComprehensiveDecision;
import name.monarchy.ai.PerformanceMetrics;
import name.monarchy.battle.BattleReport;
import name.monarchy.build.BuildStep;
import name.monarchy.kingdom.Kingdom;
import name.monarchy.kingdom.Race;
import name.monarchy.kingdom.UnitStack;
import name.monarchy.kingdom.UnitType;
import name.monarchy.mechanics.AttackType;
import name.monarchy.mechanics.CombatMechanics;
import name.monarchy.mechanics.CombatOutcome;
import name.monarchy.mechanics.Formation;
import name.monarchy.mechanics.Terrain;
import name.monarchy.personality.Personality;
import name.monarchy.personality.Traits;
import name.monarchy.strategy.StrategicDecision;
import name.monarchy.strategy.StrategyEngine;
import name.monarchy.war.WarDeclaration;
import name.monarchy.war.WarState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plays one game: every surviving kingdom asks its coordinator for a decision each tick and the
 * simulator applies it. Single-threaded; a world belongs to exactly one running game.
 */
public final class GameSimulator {

    // -------------------------
    // Economy knobs (per tick)
    // -------------------------
    private static final double INCOME_PER_ACRE = 12.0;
    private static final double INCOME_PER_STRUCTURE = 4.0;
    private static final double POPULATION_PER_ACRE = 2.0;
    private static final double POPULATION_GROWTH = 0.02;
    private static final double DOMINANCE_LAND_RATIO = 3.0;
    private static final int METRICS_EVERY = 10;
    private static final double AMBUSH_CHANCE = 0.25;

    private static final List<Terrain> TERRAINS = List.of(Terrain.values());

    private final EngineConfig config;

    public GameSimulator(EngineConfig config) {
        this.config = InvalidInputException.requirePresent("config", config);
        config.validate();
    }

    /** Fresh world with {@code kingdomsPerGame} kingdoms of random races. */
    public World setup(long seed) {
        World world = new World(config, seed);
        List<Race> races = List.of(Race.values());
        for (int i = 1; i <= config.kingdomsPerGame; i++) {
            Race race = world.rng.pick(races);
            Kingdom k = startingKingdom("k" + i, race);
            k.name = world.personalities.generate(k.id, race).fullName();
            world.addKingdom(k);
        }
        return world;
    }

    public Kingdom startingKingdom(String id, Race race) {
        Kingdom k = new Kingdom(id, id, race);
        k.gold = config.startingGold;
        k.land = config.startingLand;
        k.population = config.startingPopulation;
        k.turns = config.startingTurns;
        k.structures = config.startingStructures;
        k.temples = config.startingTemples;
        k.forts = config.startingForts;
        k.scum = config.startingScum;
        k.setUnits(UnitType.PEASANT, config.startingPeasants);
        k.setUnits(UnitType.MILITIA, config.startingMilitia);
        k.setUnits(UnitType.KNIGHT, config.startingKnights);
        k.setUnits(UnitType.CAVALRY, config.startingCavalry);
        k.criticalBuildings.add("palace");
        return k;
    }

    public GameResult play(int gameIndex, long seed) {
        return run(gameIndex, setup(seed));
    }

    // =========================
    // Game loop
    // =========================

    private static final class Tally {
        int attacks;
        int victories;
        int landGained;
        int turnsSpent;
        double lastNetworth;
        boolean lastWithEase;
    }

    private record Pair(String attackerId, String defenderId) {}

    public GameResult run(int gameIndex, World world) {
        List<Kingdom> everyone = world.kingdoms();
        List<KingdomSnapshot> start = snapshots(world, everyone, Set.of());
        Set<String> eliminated = new LinkedHashSet<>();
        Map<String, Tally> tallies = new HashMap<>();
        Map<Pair, Long> warStarted = new HashMap<>();
        for (Kingdom k : everyone) tallies.computeIfAbsent(k.id, id -> new Tally()).lastNetworth = k.networth();

        List<TurnSummary> turns = new ArrayList<>();
        String winner = null;
        GameResult.WinCondition condition = GameResult.WinCondition.TIMEOUT;
        int played = 0;

        Monarchy.LOGGER.debug("[Sim] game {} start seed={} kingdoms={}", gameIndex, world.seed, everyone.size());

        for (long tick = 1; tick <= config.maxTurns; tick++) {
            played = (int) tick;
            int builds = 0, trains = 0, attacks = 0, defends = 0, waits = 0;
            int battles = 0, victories = 0, rejected = 0, declarations = 0, peace = 0, elims = 0;

            int warsBefore = world.wars.activeWars().size();

            for (Kingdom k : world.kingdoms()) {
                if (eliminated.contains(k.id)) continue;
                ComprehensiveDecision d = world.coordinator.makeDecision(k, world.kingdoms(), tick);
                StrategicDecision primary = d.primary();
                switch (primary.action()) {
                    case BUILD -> { if (applyBuild(k, primary, d.nextBuildStep())) builds++; else waits++; }
                    case TRAIN -> { if (applyTrain(world, k, primary)) trains++; else waits++; }
                    case DEFEND -> { applyDefend(world, k, primary); defends++; }
                    case ATTACK -> {
                        attacks++;
                        BattleReport r = applyAttack(world, k, d, tallies.get(k.id), tick);
                        if (r == null || !r.accepted()) {
                            rejected++;
                        } else {
                            battles++;
                            if (r.victory()) victories++;
                        }
                    }
                    case WAIT -> waits++;
                }
            }

            for (WarDeclaration w : world.wars.activeWars()) {
                warStarted.putIfAbsent(new Pair(w.attackerId(), w.defenderId()), tick);
            }
            declarations += Math.max(0, world.wars.activeWars().size() - warsBefore);
            peace += signPeace(world, warStarted, tick);

            for (Kingdom k : world.kingdoms()) {
                if (k.land < config.eliminationLand) {
                    eliminated.add(k.id);
                    world.remove(k.id);
                    warStarted.keySet().removeIf(p -> p.attackerId().equals(k.id) || p.defenderId().equals(k.id));
                    elims++;
                    Monarchy.LOGGER.info("[Sim] game {} tick {} {} eliminated (land {})",
                            gameIndex, tick, k.id, (long) k.land);
                }
            }

            for (Kingdom k : world.kingdoms()) grow(k);

            if (tick % METRICS_EVERY == 0) sampleMetrics(world, tallies, tick);

            turns.add(new TurnSummary(tick, builds, trains, attacks, defends, waits,
                    battles, victories, rejected, declarations, peace, elims, world.size()));

            List<Kingdom> alive = world.kingdoms();
            if (alive.size() <= 1) {
                winner = alive.isEmpty() ? null : alive.get(0).id;
                condition = GameResult.WinCondition.LAST_STANDING;
                break;
            }
            String dominant = dominant(alive);
            if (dominant != null) {
                winner = dominant;
                condition = GameResult.WinCondition.DOMINANCE;
                break;
            }
        }

        if (winner == null && condition == GameResult.WinCondition.TIMEOUT) {
            winner = richest(world.kingdoms());
        }

        Race winnerRace = null;
        for (Kingdom k : everyone) if (k.id.equals(winner)) winnerRace = k.race;

        Monarchy.LOGGER.info("[Sim] game {} over after {} turns: winner={} ({}) by {}",
                gameIndex, played, winner, winnerRace, condition);

        return new GameResult(gameIndex, world.seed, winner, winnerRace, condition, played,
                start, snapshots(world, everyone, eliminated), turns,
                world.battles.recent(), world.decisions.allDecisions(), world.wars.activeWars());
    }

    // =========================
    // Actions
    // =========================

    /** Runs the optimizer's next step when affordable, otherwise plain construction. */
    boolean applyBuild(Kingdom k, StrategicDecision d, BuildStep step) {
        if (step != null && k.gold >= step.goldCost() && k.turns >= step.turnCost()) {
            k.gold -= step.goldCost();
            k.turns -= step.turnCost();
            switch (step.type()) {
                case ECONOMIC -> k.structures += (int) Math.floor(step.expectedBenefit() / 50.0);
                case MILITARY -> k.addUnits(UnitType.INFANTRY, (int) Math.floor(step.expectedBenefit() / 10.0));
                case DEFENSIVE -> k.forts += Math.max(1, (int) Math.floor(step.expectedBenefit() / 300.0));
                case EXPANSION -> k.land += Math.floor(step.expectedBenefit() / 100.0);
            }
            return true;
        }
        long cost = d.allocation().goldSpend();
        int turns = Math.max(1, d.allocation().turnsSpend());
        if (k.gold < cost || k.turns < turns) return false;
        k.gold -= cost;
        k.turns -= turns;
        k.structures += Math.max(0, d.expectedLand());
        return true;
    }

    /** One tier roll decides what the whole batch of recruits becomes. */
    boolean applyTrain(World world, Kingdom k, StrategicDecision d) {
        long cost = d.allocation().goldSpend();
        if (k.gold < cost || k.turns < 1) return false;
        double roll = world.rng.nextDouble();
        UnitType tier;
        if (roll < 0.4) tier = UnitType.MILITIA;
        else if (roll < 0.7) tier = UnitType.INFANTRY;
        else if (roll < 0.9) tier = UnitType.KNIGHT;
        else tier = UnitType.CAVALRY;

        k.gold -= cost;
        k.turns -= 1;
        k.addUnits(tier, d.allocation().unitsTrained());
        return true;
    }

    void applyDefend(World world, Kingdom k, StrategicDecision d) {
        long cost = Math.min(d.allocation().goldSpend(), (long) Math.floor(k.gold));
        k.gold -= cost;
        k.addUnits(UnitType.MILITIA, (int) Math.floor(cost / StrategyEngine.GOLD_PER_RECRUIT));
        k.forts += 1;
        if (!k.ambushActive && world.rng.nextDouble() < AMBUSH_CHANCE) k.ambushActive = true;
    }

    BattleReport applyAttack(World world, Kingdom k, ComprehensiveDecision d, Tally tally, long tick) {
        Kingdom target = world.kingdom(d.primary().targetId());
        if (target == null) return null;

        AttackType type = AttackType.STANDARD;
        if (d.attackPlan() != null && !d.attackPlan().sequence().isEmpty()
                && target.id.equals(d.attackPlan().primary().targetId())) {
            type = d.attackPlan().sequence().get(0).attackType();
        }

        List<UnitStack> army = k.unitStacks();
        if (tally.lastWithEase) army = CombatMechanics.reduceAfterWithEase(army);

        Personality p = world.personalities.generate(k.id, k.race);
        BattleReport r = world.battleSimulator.attack(k, target, army, type,
                formationFor(p.traits(), k), world.rng.pick(TERRAINS), tick);

        if (r.accepted()) {
            tally.attacks++;
            tally.turnsSpent += r.turnsSpent();
            tally.landGained += r.result().landGained();
            if (r.victory()) tally.victories++;
            tally.lastWithEase = r.result().outcome() == CombatOutcome.WITH_EASE;
        }
        return r;
    }

    static Formation formationFor(Traits t, Kingdom k) {
        if (k.unitCount(UnitType.CAVALRY) + k.unitCount(UnitType.TIER4) > k.totalUnits() / 4) {
            return Formation.CAVALRY_CHARGE;
        }
        if (t.aggression() > 1.5) return Formation.AGGRESSIVE;
        if (t.risk() < 0.8) return Formation.DEFENSIVE;
        return Formation.BALANCED;
    }

    // =========================
    // Upkeep
    // =========================

    void grow(Kingdom k) {
        k.turns = Math.min(config.maxStoredTurns, k.turns + config.turnsPerTick);
        k.gold += k.land * INCOME_PER_ACRE + k.structures * INCOME_PER_STRUCTURE;
        double cap = k.land * POPULATION_PER_ACRE;
        if (k.population < cap) {
            k.population = Math.min(cap, k.population * (1 + POPULATION_GROWTH) + 1);
        }
    }

    private int signPeace(World world, Map<Pair, Long> warStarted, long tick) {
        if (config.warDurationTurns <= 0) return 0;
        int signed = 0;
        for (Map.Entry<Pair, Long> e : new ArrayList<>(warStarted.entrySet())) {
            if (tick - e.getValue() < config.warDurationTurns) continue;
            Pair p = e.getKey();
            world.wars.makePeace(p.attackerId(), p.defenderId(), WarState.WarEndReason.PEACE_TREATY);
            warStarted.remove(p);
            signed++;
        }
        return signed;
    }

    private void sampleMetrics(World world, Map<String, Tally> tallies, long tick) {
        for (Kingdom k : world.kingdoms()) {
            Tally t = tallies.get(k.id);
            double nw = k.networth();
            double growth = t.lastNetworth <= 0 ? 0.0 : (nw - t.lastNetworth) / t.lastNetworth;
            world.coordinator.updatePerformanceMetrics(new PerformanceMetrics(
                    k.id, tick,
                    t.attacks == 0 ? 1.0 : (double) t.victories / t.attacks,
                    (double) t.landGained / METRICS_EVERY,
                    growth / METRICS_EVERY,
                    t.turnsSpent == 0 ? 0.0 : (double) t.landGained / t.turnsSpent,
                    growth));
            t.lastNetworth = nw;
        }
    }

    // =========================
    // Win conditions
    // =========================

    static String dominant(List<Kingdom> alive) {
        Kingdom leader = null;
        for (Kingdom k : alive) if (leader == null || k.land > leader.land) leader = k;
        if (leader == null) return null;
        for (Kingdom k : alive) {
            if (k == leader) continue;
            if (leader.land < k.land * DOMINANCE_LAND_RATIO) return null;
        }
        return leader.id;
    }

    static String richest(List<Kingdom> alive) {
        Kingdom best = null;
        for (Kingdom k : alive) if (best == null || k.networth() > best.networth()) best = k;
        return best == null ? null : best.id;
    }

    private static List<KingdomSnapshot> snapshots(World world, List<Kingdom> kingdoms, Set<String> eliminated) {
        List<KingdomSnapshot> out = new ArrayList<>(kingdoms.size());
        for (Kingdom k : kingdoms) {
            out.add(KingdomSnapshot.of(k, world.personalities.generate(k.id, k.race), eliminated.contains(k.id)));
        }
        return out;
    }
}
