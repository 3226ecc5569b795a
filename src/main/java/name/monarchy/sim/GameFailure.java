package name.monarchy.sim;

/** A game that threw instead of finishing. The batch records it and moves on. */
public record GameFailure(int gameIndex, long seed, String errorType, String message) {

    public static GameFailure of(int gameIndex, long seed, Throwable t) {
        return new GameFailure(gameIndex, seed, t.getClass().getName(),
                t.getMessage() == null ? "" : t.getMessage());
    }
}
