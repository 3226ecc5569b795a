package name.monarchy.ai;

import name.monarchy.build.BuildOrder;
import name.monarchy.build.BuildStep;
import name.monarchy.strategy.StrategicDecision;
import name.monarchy.target.AttackPlan;

import java.util.List;

public record ComprehensiveDecision(
        String kingdomId,
        long tick,
        StrategicDecision primary,
        BuildOrder buildOrder,
        AttackPlan attackPlan,      // null when nothing is worth attacking
        ResourcePlan resources,
        GameAnalysis analysis,
        double confidence,          // 0.1..1.0
        List<String> advice,
        List<String> reasoning      // ordered, never empty
) {
    public ComprehensiveDecision {
        advice = List.copyOf(advice);
        reasoning = List.copyOf(reasoning);
        if (reasoning.isEmpty()) throw new IllegalArgumentException("reasoning must not be empty");
    }

    public BuildStep nextBuildStep() {
        return buildOrder.steps().isEmpty() ? null : buildOrder.steps().get(0);
    }
}
