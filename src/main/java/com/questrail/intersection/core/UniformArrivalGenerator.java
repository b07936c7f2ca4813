package com.questrail.intersection.core;

import java.util.Objects;
import java.util.Random;

/**
 * {@link ArrivalGenerator} drawing uniformly from {@code [0, maxArrivals]}.
 *
 * <p>Seed it for reproducible simulations and tests.</p>
 */
public final class UniformArrivalGenerator implements ArrivalGenerator
{
    public static final int DEFAULT_MAX_ARRIVALS = 3;

    private final Random random;
    private final int maxArrivals;

    public UniformArrivalGenerator(Random random, int maxArrivals) {
        this.random = Objects.requireNonNull(random, "random");
        if (maxArrivals < 0) {
            throw new IllegalArgumentException("maxArrivals must be non-negative");
        }
        this.maxArrivals = maxArrivals;
    }

    public static UniformArrivalGenerator seeded(long seed) {
        return new UniformArrivalGenerator(new Random(seed), DEFAULT_MAX_ARRIVALS);
    }

    public static UniformArrivalGenerator unseeded() {
        return new UniformArrivalGenerator(new Random(), DEFAULT_MAX_ARRIVALS);
    }

    @Override
    public int arrivals(String laneId) {
        return random.nextInt(maxArrivals + 1);
    }
}
