package com.questrail.intersection.observability;

import java.time.Instant;
import java.util.List;

/**
 * Record of a lane re-registration. All prior lane state was discarded.
 */
public record LaneSetChangedEvent(
    Instant timestamp,
    List<String> previousLanes,
    List<String> newLanes
) {
    public LaneSetChangedEvent {
        previousLanes = List.copyOf(previousLanes);
        newLanes = List.copyOf(newLanes);
    }
}
