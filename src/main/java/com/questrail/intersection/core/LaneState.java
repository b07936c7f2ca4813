package com.questrail.intersection.core;

import com.questrail.intersection.api.LanePhase;
import com.questrail.intersection.api.LaneSnapshot;

import java.util.Objects;

/**
 * LaneState
 * -----------------------------------------------------------------------------
 * Immutable stored state of a single lane.
 *
 * It deliberately contains no behavior; transitions are driven by the
 * controller, one decision cycle at a time.
 */
public final class LaneState
{
    private final String laneId;
    private final int normal;
    private final int emergency;
    private final int wait;
    private final LanePhase phase;

    private LaneState(String laneId, int normal, int emergency, int wait, LanePhase phase) {
        this.laneId = Objects.requireNonNull(laneId, "laneId");
        this.normal = normal;
        this.emergency = emergency;
        this.wait = wait;
        this.phase = Objects.requireNonNull(phase, "phase");
    }

    public String laneId() {
        return laneId;
    }

    public int normal() {
        return normal;
    }

    public int emergency() {
        return emergency;
    }

    public int waitCycles() {
        return wait;
    }

    public LanePhase phase() {
        return phase;
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    /**
     * State of a freshly registered lane: no traffic, no aging, red.
     */
    public static LaneState initial(String laneId) {
        return new LaneState(laneId, 0, 0, 0, LanePhase.RED);
    }

    // ---------------------------------------------------------------------
    // State transition helpers
    // ---------------------------------------------------------------------

    public LaneState withCounts(int normal, int emergency) {
        return new LaneState(laneId, normal, emergency, wait, phase);
    }

    public LaneState withNormal(int normal) {
        return new LaneState(laneId, normal, emergency, wait, phase);
    }

    public LaneState withWaitReset() {
        return new LaneState(laneId, normal, emergency, 0, phase);
    }

    public LaneState withWaitIncremented() {
        return new LaneState(laneId, normal, emergency, wait + 1, phase);
    }

    public LaneState withPhase(LanePhase phase) {
        return new LaneState(laneId, normal, emergency, wait, phase);
    }

    public LaneSnapshot toSnapshot() {
        return new LaneSnapshot(laneId, normal, emergency, wait, phase);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LaneState other)) return false;
        return normal == other.normal
                && emergency == other.emergency
                && wait == other.wait
                && laneId.equals(other.laneId)
                && phase == other.phase;
    }

    @Override
    public int hashCode() {
        return Objects.hash(laneId, normal, emergency, wait, phase);
    }

    @Override
    public String toString() {
        return "LaneState[" + laneId +
                ", normal=" + normal +
                ", emergency=" + emergency +
                ", wait=" + wait +
                ", phase=" + phase +
                ']';
    }
}
