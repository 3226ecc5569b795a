package name.monarchy.personality;

/**
 * The eight personality traits. 1.0 is neutral; generated personalities keep every trait
 * inside [{@link #MIN}, {@link #MAX}].
 */
public record Traits(
        double aggression,
        double economy,
        double magic,
        double diplomacy,
        double risk,
        double patience,
        double adaptability,
        double loyalty
) {
    public static final double MIN = 0.3;
    public static final double MAX = 2.5;

    public static final Traits NEUTRAL = new Traits(1, 1, 1, 1, 1, 1, 1, 1);

    public Traits times(Traits m) {
        return new Traits(
                aggression * m.aggression,
                economy * m.economy,
                magic * m.magic,
                diplomacy * m.diplomacy,
                risk * m.risk,
                patience * m.patience,
                adaptability * m.adaptability,
                loyalty * m.loyalty
        );
    }

    public Traits clamped() {
        return new Traits(
                clamp(aggression), clamp(economy), clamp(magic), clamp(diplomacy),
                clamp(risk), clamp(patience), clamp(adaptability), clamp(loyalty)
        );
    }

    public double[] toArray() {
        return new double[] { aggression, economy, magic, diplomacy, risk, patience, adaptability, loyalty };
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 1.0;
        return Math.max(MIN, Math.min(MAX, v));
    }
}
