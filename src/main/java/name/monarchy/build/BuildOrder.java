package name.monarchy.build;

import name.monarchy.kingdom.GamePhase;
import name.monarchy.kingdom.Race;

import java.util.List;

public record BuildOrder(
        Race race,
        GamePhase phase,
        List<BuildStep> steps,
        long totalGold,
        int totalTurns,
        double expectedNetworth
) {
    public BuildOrder {
        steps = List.copyOf(steps);
    }

    public record Validation(boolean feasible, List<String> issues) {
        public Validation {
            issues = List.copyOf(issues);
        }
    }
}
