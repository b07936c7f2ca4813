package com.questrail.intersection.api;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ControllerSnapshot
 * -----------------------------------------------------------------------------
 * Point-in-time copy of a controller's full state, for status reporting.
 *
 * <p>The {@code normal} counts in {@link #lanes()} are the post-cycle values
 * produced by the demand evolution model, not the last readings supplied.</p>
 *
 * @param lanes              lane states in registration order
 * @param currentGreen       lane currently holding green, if any
 * @param greenStartedAt     wall-clock instant of the last green transition, if any
 * @param allottedGreen      green duration allotted to {@code currentGreen}
 * @param lastEmergencyLane  lane last granted green for an emergency, if any
 */
public record ControllerSnapshot(
        List<LaneSnapshot> lanes,
        Optional<String> currentGreen,
        Optional<Instant> greenStartedAt,
        Duration allottedGreen,
        Optional<String> lastEmergencyLane
) {
    public ControllerSnapshot {
        lanes = List.copyOf(Objects.requireNonNull(lanes, "lanes"));
        Objects.requireNonNull(currentGreen, "currentGreen");
        Objects.requireNonNull(greenStartedAt, "greenStartedAt");
        Objects.requireNonNull(allottedGreen, "allottedGreen");
        Objects.requireNonNull(lastEmergencyLane, "lastEmergencyLane");
    }

    public static ControllerSnapshot empty() {
        return new ControllerSnapshot(List.of(), Optional.empty(), Optional.empty(),
                Duration.ZERO, Optional.empty());
    }

    public Optional<LaneSnapshot> lane(String laneId) {
        return lanes.stream().filter(l -> l.laneId().equals(laneId)).findFirst();
    }
}
