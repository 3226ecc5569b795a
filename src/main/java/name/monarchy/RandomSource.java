package name.monarchy;

import java.util.List;
import java.util.Random;

/**
 * All randomness in the engine goes through this so simulations can be replayed from a seed.
 */
public interface RandomSource {

    double nextDouble();

    int nextInt(int bound);

    double nextGaussian();

    /** Uniform in [min, max). */
    default double range(double min, double max) {
        return min + nextDouble() * (max - min);
    }

    default <T> T pick(List<T> list) {
        return list.get(nextInt(list.size()));
    }

    static RandomSource create(long seed) {
        return new Seeded(seed);
    }

    /** Always returns the same fraction; useful to pin range draws in tests. */
    static RandomSource fixed(double value) {
        return new RandomSource() {
            @Override public double nextDouble() { return value; }
            @Override public int nextInt(int bound) { return (int) Math.min(bound - 1, Math.floor(value * bound)); }
            @Override public double nextGaussian() { return 0.0; }
        };
    }

    final class Seeded implements RandomSource {
        private final Random random;

        private Seeded(long seed) {
            this.random = new Random(seed);
        }

        @Override public double nextDouble() { return random.nextDouble(); }
        @Override public int nextInt(int bound) { return random.nextInt(bound); }
        @Override public double nextGaussian() { return random.nextGaussian(); }
    }
}
