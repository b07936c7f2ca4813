package com.questrail.intersection.sim;

import com.questrail.intersection.time.MonotonicClock;

/**
 * Monotonic clock driven by the simulation loop rather than by real time, so
 * that each cycle's green interval is treated as fully elapsed.
 */
final class SimulatedClock implements MonotonicClock
{
    private long nowNanos;

    @Override
    public long nowNanos() {
        return nowNanos;
    }

    void advanceSeconds(double seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("Cannot advance monotonic clock backwards");
        }
        nowNanos += (long) (seconds * 1_000_000_000L);
    }
}
