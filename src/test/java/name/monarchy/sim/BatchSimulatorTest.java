package name.monarchy.sim;

import name.monarchy.EngineConfig;
import name.monarchy.kingdom.Kingdom;
import name.monarchy.kingdom.Race;
import name.monarchy.personality.PersonalityGenerator;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class BatchSimulatorTest {

    private static final PersonalityGenerator PERSONALITIES = new PersonalityGenerator();

    private static KingdomSnapshot snapshot(String id, Race race) {
        return KingdomSnapshot.of(new Kingdom(id, id, race), PERSONALITIES.generate(id, race), false);
    }

    private static GameResult stubResult(int index, long seed) {
        List<KingdomSnapshot> start = List.of(snapshot("h", Race.HUMAN), snapshot("d", Race.DROBEN));
        return new GameResult(index, seed, "h", Race.HUMAN, GameResult.WinCondition.TIMEOUT, 1,
                start, start, List.of(), List.of(), List.of(), List.of());
    }

    @Test
    public void failingGameDoesNotSinkTheBatch() {
        BatchSimulator batch = new BatchSimulator(3, (index, seed) -> {
            if (index == 2) throw new IllegalStateException("boom");
            return stubResult(index, seed);
        });

        BatchResult r = batch.run(5, 42L);
        assertEquals(5, r.requested());
        assertEquals(4, r.completed());
        assertEquals(1, r.failures().size());
        assertEquals(2, r.failures().get(0).gameIndex());
        assertEquals(BatchSimulator.gameSeed(42L, 2), r.failures().get(0).seed());
        assertEquals("java.lang.IllegalStateException", r.failures().get(0).errorType());
        assertEquals("boom", r.failures().get(0).message());
        assertEquals(0, r.cancelled());
    }

    @Test
    public void resultsComeBackInGameOrder() {
        BatchResult r = new BatchSimulator(4, BatchSimulatorTest::stubResult).run(8, 1L);
        for (int i = 0; i < r.results().size(); i++) {
            assertEquals(i, r.results().get(i).gameIndex());
        }
    }

    @Test
    public void cancellationSkipsGamesNotYetStarted() {
        AtomicInteger polled = new AtomicInteger();
        BatchSimulator batch = new BatchSimulator(1, BatchSimulatorTest::stubResult);

        BatchResult r = batch.run(5, 42L, () -> polled.incrementAndGet() > 2);
        assertEquals(2, r.completed());
        assertEquals(3, r.cancelled());
        assertTrue(r.failures().isEmpty());
    }

    @Test
    public void everyGameGetsItsOwnSeed() {
        Set<Long> seeds = new HashSet<>();
        for (int i = 0; i < 1000; i++) seeds.add(BatchSimulator.gameSeed(42L, i));
        assertEquals(1000, seeds.size());
        assertEquals(BatchSimulator.gameSeed(42L, 3), BatchSimulator.gameSeed(42L, 3));
    }

    @Test
    public void raceStatsCountGamesAndWins() {
        BatchResult r = new BatchSimulator(2, BatchSimulatorTest::stubResult).run(3, 9L);
        assertEquals(3, r.raceStats().get(Race.HUMAN).games());
        assertEquals(3, r.raceStats().get(Race.HUMAN).wins());
        assertEquals(1.0, r.raceStats().get(Race.HUMAN).winRate(), 0.0);
        assertEquals(0, r.raceStats().get(Race.DROBEN).wins());
        assertEquals(0.0, r.raceStats().get(Race.DROBEN).winRate(), 0.0);
    }

    @Test
    public void parallelBatchMatchesSequentialBatch() {
        EngineConfig c = EngineConfig.defaults();
        c.kingdomsPerGame = 2;
        c.maxTurns = 10;

        c.threads = 1;
        BatchResult one = new BatchSimulator(c).run(3, 77L);
        c.threads = 3;
        BatchResult three = new BatchSimulator(c).run(3, 77L);

        assertEquals(3, one.completed());
        for (int i = 0; i < 3; i++) {
            assertEquals(one.results().get(i).winnerId(), three.results().get(i).winnerId());
            assertEquals(one.results().get(i).end(), three.results().get(i).end());
        }
    }

    @Test
    public void emptyBatch() {
        BatchResult r = new BatchSimulator(2, BatchSimulatorTest::stubResult).run(0, 1L);
        assertEquals(0, r.completed());
        assertTrue(r.raceStats().isEmpty());
    }

    @Test
    public void errorsInOneGameAreRecordedToo() {
        BatchSimulator batch = new BatchSimulator(2, (index, seed) -> {
            if (index == 1) throw new StackOverflowError();
            if (index == 2) throw new AssertionError("bad state");
            return stubResult(index, seed);
        });

        BatchResult r = batch.run(4, 42L);
        assertEquals(2, r.completed());
        assertEquals(2, r.failures().size());
        assertEquals("java.lang.StackOverflowError", r.failures().get(0).errorType());
        assertEquals("", r.failures().get(0).message());
        assertEquals("java.lang.AssertionError", r.failures().get(1).errorType());
        assertEquals(3, r.results().get(1).gameIndex());
    }
}
