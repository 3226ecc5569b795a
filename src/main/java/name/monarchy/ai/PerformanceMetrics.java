package name.monarchy.ai;

/** One sample of how well a kingdom's decisions have been paying off. */
public record PerformanceMetrics(
        String kingdomId,
        long tick,
        double attackSuccessRate,
        double landAcquisitionRate,
        double economicGrowthRate,
        double turnEfficiency,
        double networthGrowth
) {}
