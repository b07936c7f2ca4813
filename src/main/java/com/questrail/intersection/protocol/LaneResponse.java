package com.questrail.intersection.protocol;

import com.questrail.intersection.api.ControllerSnapshot;
import com.questrail.intersection.api.DecisionReport;
import com.questrail.intersection.api.LaneReading;
import com.questrail.intersection.detection.PipelineStatus;

import java.util.List;
import java.util.Objects;

/**
 * Responses produced by the intersection service.
 */
public sealed interface LaneResponse extends LaneMessage {

    record Decision(DecisionReport report) implements LaneResponse {
        public Decision {
            Objects.requireNonNull(report, "report");
        }
    }

    record Status(ControllerSnapshot snapshot) implements LaneResponse {
        public Status {
            Objects.requireNonNull(snapshot, "snapshot");
        }
    }

    /**
     * @param counts    lane counts aggregated from the detections
     * @param fallbacks detections counted as normal because classification failed
     * @param report    decision taken on {@code counts}
     */
    record DetectionResult(List<LaneReading> counts, int fallbacks, DecisionReport report)
            implements LaneResponse {
        public DetectionResult {
            counts = List.copyOf(Objects.requireNonNull(counts, "counts"));
            Objects.requireNonNull(report, "report");
        }
    }

    record Pipeline(PipelineStatus status) implements LaneResponse {
        public Pipeline {
            Objects.requireNonNull(status, "status");
        }
    }

    record Failure(ErrorCode code, String message) implements LaneResponse {
        public Failure {
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(message, "message");
        }
    }

    /**
     * Why a well-formed request could not be served.
     */
    enum ErrorCode {
        /** Request content violates a contract (negative count, duplicate lane, ...). */
        INVALID_REQUEST(1),
        /** Unexpected failure while serving the request. */
        INTERNAL(2);

        private final int wireValue;

        ErrorCode(int wireValue) {
            this.wireValue = wireValue;
        }

        public int wireValue() {
            return wireValue;
        }

        public static ErrorCode fromWire(int value) {
            for (ErrorCode c : values()) {
                if (c.wireValue == value) {
                    return c;
                }
            }
            throw new IllegalArgumentException("Unknown error code: " + value);
        }
    }
}
