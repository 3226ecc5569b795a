package name.monarchy.strategy;

import java.util.List;

public record StrategicDecision(
        ActionType action,
        int priority,
        ResourceAllocation allocation,
        String targetId,        // attack only
        int expectedLand,
        RiskLevel risk,
        List<String> reasoning  // ordered, never empty
) {
    public StrategicDecision {
        reasoning = List.copyOf(reasoning);
        if (reasoning.isEmpty()) throw new IllegalArgumentException("reasoning must not be empty");
    }

    public static StrategicDecision waitTurn(String why) {
        return new StrategicDecision(ActionType.WAIT, 0, ResourceAllocation.NONE, null, 0, RiskLevel.LOW, List.of(why));
    }
}
