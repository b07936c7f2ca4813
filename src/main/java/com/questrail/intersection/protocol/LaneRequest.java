package com.questrail.intersection.protocol;

import com.questrail.intersection.api.LaneReading;
import com.questrail.intersection.detection.Detection;

import java.util.List;
import java.util.Objects;

/**
 * Requests accepted by the intersection service.
 */
public sealed interface LaneRequest extends LaneMessage {

    /**
     * Run one decision cycle over the given readings.
     */
    record Decide(List<LaneReading> readings) implements LaneRequest {
        public Decide {
            readings = List.copyOf(Objects.requireNonNull(readings, "readings"));
        }
    }

    /**
     * Report the full controller state.
     */
    record Status() implements LaneRequest {
    }

    /**
     * Aggregate raw detections into lane counts, then run one decision cycle.
     */
    record SubmitDetections(List<Detection> detections) implements LaneRequest {
        public SubmitDetections {
            detections = List.copyOf(Objects.requireNonNull(detections, "detections"));
        }
    }

    /**
     * Report classifier / embedder availability.
     */
    record PipelineStatusQuery() implements LaneRequest {
    }
}
