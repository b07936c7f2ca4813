package com.questrail.intersection.api;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Per-lane entry of a {@link DecisionReport}.
 *
 * @param phase     signal phase after the cycle
 * @param waitCycles aging counter after the cycle
 * @param greenTime allotted green seconds; present only for the chosen lane
 */
public record LaneReport(LanePhase phase, int waitCycles, OptionalDouble greenTime)
{
    public LaneReport {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(greenTime, "greenTime");
        if (waitCycles < 0) {
            throw new IllegalArgumentException("waitCycles must be non-negative: " + waitCycles);
        }
    }

    public static LaneReport waiting(LanePhase phase, int waitCycles) {
        return new LaneReport(phase, waitCycles, OptionalDouble.empty());
    }

    public static LaneReport green(int waitCycles, double greenTime) {
        return new LaneReport(LanePhase.GREEN, waitCycles, OptionalDouble.of(greenTime));
    }
}
