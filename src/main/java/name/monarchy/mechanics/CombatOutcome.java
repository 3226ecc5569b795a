package name.monarchy.mechanics;

public enum CombatOutcome {
    WITH_EASE("with_ease", 0.05, 0.20, 0.070, 0.0735),
    GOOD_FIGHT("good_fight", 0.15, 0.15, 0.0679, 0.070),
    FAILED("failed", 0.25, 0.05, 0.0, 0.0);

    public final String id;
    public final double attackerCasualtyRate;
    public final double defenderCasualtyRate;
    public final double landMin;
    public final double landMax;

    CombatOutcome(String id, double attackerCasualtyRate, double defenderCasualtyRate,
                  double landMin, double landMax) {
        this.id = id;
        this.attackerCasualtyRate = attackerCasualtyRate;
        this.defenderCasualtyRate = defenderCasualtyRate;
        this.landMin = landMin;
        this.landMax = landMax;
    }

    public boolean isVictory() {
        return this != FAILED;
    }
}
