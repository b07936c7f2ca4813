package com.questrail.intersection.api;

import java.util.Objects;

/**
 * LaneReading
 * -----------------------------------------------------------------------------
 * One externally supplied observation of a lane for a single decision cycle.
 *
 * <p>Counts are authoritative for the cycle they are supplied in. Negative
 * counts are rejected at construction rather than clamped.</p>
 *
 * @param laneId    stable lane identity (non-blank)
 * @param normal    queued ordinary vehicles (non-negative)
 * @param emergency queued emergency vehicles (non-negative)
 */
public record LaneReading(String laneId, int normal, int emergency)
{
    public LaneReading {
        Objects.requireNonNull(laneId, "laneId");
        if (laneId.isBlank()) {
            throw new IllegalArgumentException("laneId must not be blank");
        }
        if (normal < 0) {
            throw new IllegalArgumentException("normal must be non-negative: " + normal);
        }
        if (emergency < 0) {
            throw new IllegalArgumentException("emergency must be non-negative: " + emergency);
        }
    }

    public static LaneReading of(String laneId, int normal, int emergency) {
        return new LaneReading(laneId, normal, emergency);
    }
}
