package com.questrail.intersection.config;

/**
 * SignalTimingPolicy
 * -----------------------------------------------------------------------------
 * Tuning constants for the decision loop.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>minGreen</b> / <b>maxGreen</b>: bounds, in seconds, for any allotted
 *       green duration.</li>
 *   <li><b>yellowTime</b>: nominal yellow interval in seconds. Advisory only:
 *       the transition to green is applied within the same cycle and is never
 *       delayed by this value.</li>
 *   <li><b>waitBoost</b>: per-cycle aging multiplier applied to queue length
 *       when scoring ordinary traffic.</li>
 *   <li><b>starvationLimit</b>: aging threshold, in cycles, at which a lane
 *       receives the fixed starvation bonus.</li>
 *   <li><b>clearanceRate</b>: vehicles served per second of green; drives both
 *       green estimation and simulated departures.</li>
 * </ul>
 */
public record SignalTimingPolicy(
        double minGreen,
        double maxGreen,
        double yellowTime,
        double waitBoost,
        int starvationLimit,
        double clearanceRate
) {
    public SignalTimingPolicy {
        requireFinite(minGreen, "minGreen");
        requireFinite(maxGreen, "maxGreen");
        requireFinite(yellowTime, "yellowTime");
        requireFinite(waitBoost, "waitBoost");
        requireFinite(clearanceRate, "clearanceRate");

        if (minGreen < 0) {
            throw new IllegalArgumentException("minGreen must be non-negative");
        }
        if (maxGreen < minGreen) {
            throw new IllegalArgumentException("maxGreen must not be less than minGreen");
        }
        if (yellowTime < 0) {
            throw new IllegalArgumentException("yellowTime must be non-negative");
        }
        if (waitBoost < 0) {
            throw new IllegalArgumentException("waitBoost must be non-negative");
        }
        if (starvationLimit < 0) {
            throw new IllegalArgumentException("starvationLimit must be non-negative");
        }
        if (clearanceRate <= 0) {
            throw new IllegalArgumentException("clearanceRate must be positive");
        }
    }

    /**
     * Controller defaults.
     *
     * <ul>
     *   <li>minGreen: 3s, maxGreen: 15s, yellowTime: 2s</li>
     *   <li>waitBoost: 0.4, starvationLimit: 8 cycles</li>
     *   <li>clearanceRate: 3 vehicles/s</li>
     * </ul>
     */
    public static SignalTimingPolicy defaults() {
        return new SignalTimingPolicy(3.0, 15.0, 2.0, 0.4, 8, 3.0);
    }

    /**
     * Defaults used by the hosting service: a shorter maximum green and a
     * slower clearance rate than {@link #defaults()}.
     */
    public static SignalTimingPolicy hostDefaults() {
        return new SignalTimingPolicy(3.0, 12.0, 2.0, 0.4, 8, 2.5);
    }

    public SignalTimingPolicy withGreenBounds(double minGreen, double maxGreen) {
        return new SignalTimingPolicy(minGreen, maxGreen, yellowTime, waitBoost, starvationLimit, clearanceRate);
    }

    public SignalTimingPolicy withClearanceRate(double clearanceRate) {
        return new SignalTimingPolicy(minGreen, maxGreen, yellowTime, waitBoost, starvationLimit, clearanceRate);
    }

    public SignalTimingPolicy withStarvationLimit(int starvationLimit) {
        return new SignalTimingPolicy(minGreen, maxGreen, yellowTime, waitBoost, starvationLimit, clearanceRate);
    }

    private static void requireFinite(double value, String name) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be finite");
        }
    }
}
