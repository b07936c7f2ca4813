package com.questrail.intersection.observability;

import com.questrail.intersection.api.DecisionReport;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of one completed decision cycle.
 *
 * @param laneChanged true if green moved to a different lane in this cycle
 */
public record DecisionEvent(
    Instant timestamp,
    DecisionReport report,
    boolean laneChanged
) {
    public DecisionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(report, "report");
    }
}
