package name.monarchy.sim;

import name.monarchy.kingdom.Race;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record BatchResult(
        long seed,
        int requested,
        List<GameResult> results,   // game index order
        List<GameFailure> failures,
        int cancelled,
        Map<Race, RaceStats> raceStats
) {
    public BatchResult {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
        // keep race order for reports
        raceStats = raceStats.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(raceStats));
    }

    public record RaceStats(int games, int wins) {
        public double winRate() {
            return games == 0 ? 0.0 : (double) wins / games;
        }
    }

    public int completed() {
        return results.size();
    }
}
