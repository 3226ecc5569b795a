package name.monarchy.build;

public record BuildStep(
        BuildStepType type,
        double priority,
        long goldCost,
        int turnCost,
        double expectedBenefit,
        String description
) {
    /** Turns are valued at this much gold when comparing steps. */
    public static final double GOLD_PER_TURN = 100.0;

    public double efficiency() {
        return expectedBenefit / (goldCost + turnCost * GOLD_PER_TURN);
    }

    public BuildStep withPriority(double p) {
        return new BuildStep(type, p, goldCost, turnCost, expectedBenefit, description);
    }
}
