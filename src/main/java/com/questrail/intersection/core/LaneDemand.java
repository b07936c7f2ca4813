package com.questrail.intersection.core;

import java.util.Objects;

/**
 * One entry of the per-cycle working snapshot: the caller's counts merged with
 * the lane's retained aging counter.
 */
public record LaneDemand(String laneId, int normal, int emergency, int waitCycles)
{
    public LaneDemand {
        Objects.requireNonNull(laneId, "laneId");
        if (normal < 0 || emergency < 0 || waitCycles < 0) {
            throw new IllegalArgumentException("counts must be non-negative: " + laneId);
        }
    }

    public LaneDemand withNormal(int normal) {
        return new LaneDemand(laneId, normal, emergency, waitCycles);
    }
}
