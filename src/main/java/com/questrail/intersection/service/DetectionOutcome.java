package com.questrail.intersection.service;

import com.questrail.intersection.api.DecisionReport;
import com.questrail.intersection.detection.AggregationResult;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link IntersectionService#submitDetections(List)}.
 *
 * @param aggregation lane counts derived from the detections
 * @param report      decision taken on those counts
 * @param warnings    pipeline load errors present when the batch was served;
 *                    empty when the pipeline is healthy
 */
public record DetectionOutcome(AggregationResult aggregation, DecisionReport report, List<String> warnings)
{
    public DetectionOutcome {
        Objects.requireNonNull(aggregation, "aggregation");
        Objects.requireNonNull(report, "report");
        warnings = List.copyOf(warnings);
    }
}
