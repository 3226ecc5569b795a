package name.monarchy.kingdom;

public enum GamePhase {
    EARLY, MID, LATE;

    /** Turn 0..20 early, ..60 mid, later is late. */
    public static GamePhase ofTurn(int turn) {
        if (turn <= 20) return EARLY;
        if (turn <= 60) return MID;
        return LATE;
    }
}
