package com.questrail.intersection.api;

import java.util.Objects;

/**
 * Diagnostic view of one lane's full stored state.
 */
public record LaneSnapshot(String laneId, int normal, int emergency, int waitCycles, LanePhase phase)
{
    public LaneSnapshot {
        Objects.requireNonNull(laneId, "laneId");
        Objects.requireNonNull(phase, "phase");
    }
}
