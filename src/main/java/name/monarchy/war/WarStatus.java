package name.monarchy.war;

/**
 * Per attacker-defender pair: NEUTRAL, TRACKING (1-2 attacks), WAR_REQUIRED (3+ attacks,
 * undeclared), AT_WAR (declared). Peace returns the pair to NEUTRAL.
 */
public enum WarStatus {
    NEUTRAL, TRACKING, WAR_REQUIRED, AT_WAR;

    static WarStatus forCount(int attackCount) {
        if (attackCount <= 0) return NEUTRAL;
        if (attackCount < 3) return TRACKING;
        return WAR_REQUIRED;
    }
}
