package com.questrail.intersection.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for green-expiry decisions.
 *
 * <h2>Binding invariant</h2>
 * Whether the current green has run its allotted time MUST be judged on a
 * monotonic time source. Wall-clock time (e.g. {@code Instant.now()}) is
 * permitted only for reporting.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
