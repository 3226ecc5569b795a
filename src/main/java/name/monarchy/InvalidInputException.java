package name.monarchy;

/**
 * Thrown when a kingdom snapshot or call argument is missing, NaN or negative.
 * Callers that see this can rely on no state having been mutated.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }

    public static double requireFinite(String field, double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            throw new InvalidInputException(field + " must be a finite number, got " + v);
        }
        return v;
    }

    public static double requireNonNegative(String field, double v) {
        requireFinite(field, v);
        if (v < 0) throw new InvalidInputException(field + " must be >= 0, got " + v);
        return v;
    }

    public static <T> T requirePresent(String field, T v) {
        if (v == null) throw new InvalidInputException(field + " is missing");
        return v;
    }
}
