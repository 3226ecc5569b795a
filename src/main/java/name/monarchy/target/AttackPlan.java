package name.monarchy.target;

import name.monarchy.mechanics.AttackType;

import java.util.List;

public record AttackPlan(
        TargetAnalysis primary,
        List<TargetAnalysis> alternatives,
        List<Step> sequence,
        int totalTurns,
        int expectedLand,
        long expectedGold
) {
    public AttackPlan {
        alternatives = List.copyOf(alternatives);
        sequence = List.copyOf(sequence);
    }

    public record Step(String targetId, AttackType attackType, int turnCost, int expectedLand, long expectedGold) {}
}
