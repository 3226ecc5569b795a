package name.monarchy.strategy;

public record ResourceAllocation(long goldSpend, int turnsSpend, int unitsTrained, double expectedReturn) {
    public static final ResourceAllocation NONE = new ResourceAllocation(0, 0, 0, 0);
}
