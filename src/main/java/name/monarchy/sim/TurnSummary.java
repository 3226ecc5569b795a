package name.monarchy.sim;

/** Counters for one simulated tick of one game. */
public record TurnSummary(
        long tick,
        int builds,
        int trains,
        int attacks,
        int defends,
        int waits,
        int battles,
        int victories,
        int rejected,
        int warDeclarations,
        int peaceTreaties,
        int eliminations,
        int alive
) {}
