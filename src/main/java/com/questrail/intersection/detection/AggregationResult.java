package com.questrail.intersection.detection;

import com.questrail.intersection.api.LaneReading;

import java.util.List;

/**
 * Lane counts produced from one batch of detections.
 *
 * @param readings  one reading per lane, in first-seen order
 * @param fallbacks detections that could not be classified and were counted as normal
 * @param skipped   detections dropped because they had no lane
 */
public record AggregationResult(List<LaneReading> readings, int fallbacks, int skipped)
{
    public AggregationResult {
        readings = List.copyOf(readings);
    }
}
