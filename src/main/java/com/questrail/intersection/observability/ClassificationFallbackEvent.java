package com.questrail.intersection.observability;

import java.time.Instant;

/**
 * Record of a detection that could not be classified and was counted as
 * ordinary traffic.
 */
public record ClassificationFallbackEvent(
    Instant timestamp,
    String laneId,
    String reason
) {
}
