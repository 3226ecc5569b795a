package name.monarchy.sim;

import name.monarchy.EngineConfig;
import name.monarchy.InvalidInputException;
import name.monarchy.Monarchy;
import name.monarchy.kingdom.Race;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/**
 * Runs many independent games, each in its own {@link World}. A game that throws is logged and recorded
 * as a {@link GameFailure}; the rest of the batch carries on. The cancellation check is polled before
 * each game starts; a game already running is never interrupted.
 */
public final class BatchSimulator {

    /** Plays one game. Exists so callers can swap the game for a stub. */
    public interface GameRunner {
        GameResult play(int gameIndex, long seed);
    }

    // one slot per game; a null slot means the game was skipped
    private record Outcome(GameResult result, GameFailure failure) {
        static Outcome done(GameResult r) { return new Outcome(r, null); }
        static Outcome failed(GameFailure f) { return new Outcome(null, f); }
    }

    private static final long SEED_STRIDE = 0x9E3779B97F4A7C15L;

    private final int threads;
    private final GameRunner runner;

    public BatchSimulator(EngineConfig config) {
        this(config.threads, new GameSimulator(config)::play);
    }

    public BatchSimulator(int threads, GameRunner runner) {
        if (threads < 1) throw new InvalidInputException("threads must be >= 1");
        this.threads = threads;
        this.runner = InvalidInputException.requirePresent("runner", runner);
    }

    public static long gameSeed(long batchSeed, int gameIndex) {
        return batchSeed + SEED_STRIDE * (gameIndex + 1L);
    }

    public BatchResult run(int games, long seed) {
        return run(games, seed, () -> false);
    }

    public BatchResult run(int games, long seed, BooleanSupplier cancelled) {
        if (games < 0) throw new InvalidInputException("games must be >= 0");
        BooleanSupplier cancel = cancelled == null ? () -> false : cancelled;

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, games)));
        List<Future<Outcome>> futures = new ArrayList<>(games);
        try {
            for (int i = 0; i < games; i++) {
                final int index = i;
                final long gameSeed = gameSeed(seed, i);
                futures.add(pool.submit(() -> {
                    if (cancel.getAsBoolean()) return null;
                    try {
                        return Outcome.done(runner.play(index, gameSeed));
                    } catch (Throwable e) {
                        // a dying VM ends the batch; a runaway recursion only ends its game
                        if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) throw (VirtualMachineError) e;
                        Monarchy.LOGGER.warn("[Sim] game {} (seed {}) failed: {}", index, gameSeed, e.toString());
                        return Outcome.failed(GameFailure.of(index, gameSeed, e));
                    }
                }));
            }

            List<GameResult> results = new ArrayList<>();
            List<GameFailure> failures = new ArrayList<>();
            int skipped = 0;
            for (int i = 0; i < futures.size(); i++) {
                Outcome o = await(futures.get(i), i, gameSeed(seed, i));
                if (o == null) skipped++;
                else if (o.failure() != null) failures.add(o.failure());
                else results.add(o.result());
            }

            if (skipped > 0) {
                Monarchy.LOGGER.info("[Sim] batch cancelled: {} of {} games skipped", skipped, games);
            }
            Monarchy.LOGGER.info("[Sim] batch done: {} completed, {} failed, {} skipped",
                    results.size(), failures.size(), skipped);
            return new BatchResult(seed, games, results, failures, skipped, raceStats(results));
        } finally {
            pool.shutdownNow();
        }
    }

    private static <T> T await(Future<T> f, int index, long seed) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for game " + index, e);
        } catch (ExecutionException e) {
            // only VM errors such as OutOfMemoryError get past the per-game catch
            throw new IllegalStateException("Game " + index + " (seed " + seed + ") aborted the batch", e.getCause());
        }
    }

    static EnumMap<Race, BatchResult.RaceStats> raceStats(List<GameResult> results) {
        EnumMap<Race, int[]> counts = new EnumMap<>(Race.class);
        for (GameResult r : results) {
            Set<Race> seen = new HashSet<>();
            for (KingdomSnapshot k : r.start()) {
                if (seen.add(k.race())) counts.computeIfAbsent(k.race(), x -> new int[2])[0]++;
            }
            if (r.winnerRace() != null) counts.computeIfAbsent(r.winnerRace(), x -> new int[2])[1]++;
        }
        EnumMap<Race, BatchResult.RaceStats> out = new EnumMap<>(Race.class);
        counts.forEach((race, c) -> out.put(race, new BatchResult.RaceStats(c[0], c[1])));
        return out;
    }
}
