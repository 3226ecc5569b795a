package name.monarchy.target;

public record TargetAnalysis(
        String targetId,
        CombatPrediction combat,
        StrategicValue strategic,
        RiskAssessment risk,
        double overallScore,
        Recommendation recommendation
) {

    public record CombatPrediction(
            double adjustedRatio,
            double successProbability,
            int expectedLand,
            long expectedGold,
            int turnCost,
            double efficiency,      // expected acres per turn
            double casualtyRate
    ) {}

    public record StrategicValue(
            double threatLevel,     // 0..1
            double resourceValue,
            double positionValue,
            double allianceRisk
    ) {}

    public record RiskAssessment(
            boolean warDeclarationRisk,
            double retaliationRisk,
            double lossRisk,
            double opportunityCost
    ) {}
}
