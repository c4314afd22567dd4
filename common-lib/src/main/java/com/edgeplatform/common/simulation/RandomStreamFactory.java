package com.edgeplatform.common.simulation;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Hands out independent random streams derived from one root seed.
 *
 * <p>Every game gets its own stream keyed by event id, so results do not depend on the order
 * in which games are simulated or on which thread runs them. Never share a stream between
 * concurrent simulations; use {@link SplittableRandom#split()} instead.
 */
public final class RandomStreamFactory {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final long seed;

    public RandomStreamFactory(long seed) {
        this.seed = seed;
    }

    /** A factory seeded from the clock, for runs that need no reproducibility. */
    public static RandomStreamFactory unseeded() {
        return new RandomStreamFactory(System.nanoTime());
    }

    public SplittableRandom streamFor(String key) {
        long mixed = seed ^ (Objects.hashCode(key) * GOLDEN_GAMMA);
        return new SplittableRandom(mixed);
    }

    public long seed() {
        return seed;
    }
}
