package com.questrail.intersection.protocol.codec;

import com.questrail.intersection.api.*;
import com.questrail.intersection.detection.Detection;
import com.questrail.intersection.detection.PipelineStatus;
import com.questrail.intersection.protocol.LaneMessage;
import com.questrail.intersection.protocol.LaneRequest;
import com.questrail.intersection.protocol.LaneResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

import static com.questrail.intersection.protocol.codec.LaneMessageType.*;

/**
 * LaneMessageDecoder
 * ============================================================================
 * Converts a CRC-valid {@link LaneFrame} into a semantic {@link LaneMessage}.
 *
 * <p>Body layouts are documented on {@link LaneMessageEncoder}. Any frame that
 * cannot be interpreted, including one whose fields violate a message
 * contract, raises {@link LaneDecodeException}.</p>
 */
public final class LaneMessageDecoder
{
    public LaneMessage decode(LaneFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        WireReader r = new WireReader(frame.body());
        try {
            LaneMessage message = switch (frame.type()) {
                case DECIDE -> readDecide(r);
                case STATUS -> new LaneRequest.Status();
                case DETECTIONS -> readDetections(r);
                case PIPELINE_STATUS -> new LaneRequest.PipelineStatusQuery();
                case DECISION_RESPONSE -> new LaneResponse.Decision(readDecision(r));
                case STATUS_RESPONSE -> new LaneResponse.Status(readSnapshot(r));
                case DETECTION_RESULT_RESPONSE -> readDetectionResult(r);
                case PIPELINE_STATUS_RESPONSE -> readPipeline(r);
                case FAILURE_RESPONSE -> new LaneResponse.Failure(
                        LaneResponse.ErrorCode.fromWire(r.u8()), r.longStr());
                default -> throw new LaneDecodeException(
                        "Unknown message type: 0x" + Integer.toHexString(frame.type()));
            };
            r.expectEnd();
            return message;
        }
        catch (IllegalArgumentException e) {
            throw new LaneDecodeException("Invalid " + frame + ": " + e.getMessage(), e);
        }
    }

    private static LaneRequest.Decide readDecide(WireReader r)
    {
        int n = r.u8();
        List<LaneReading> readings = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            readings.add(new LaneReading(r.str(), r.u16(), r.u16()));
        }
        return new LaneRequest.Decide(readings);
    }

    private static LaneRequest.SubmitDetections readDetections(WireReader r)
    {
        int n = r.u16();
        List<Detection> detections = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            String lane = r.bool() ? r.str() : null;
            int kind = r.u8();
            detections.add(switch (kind) {
                case SOURCE_NONE -> Detection.unclassified(lane);
                case SOURCE_LABEL -> Detection.labeled(lane, r.str());
                case SOURCE_EMBEDDING -> Detection.embedded(lane, readVector(r));
                case SOURCE_IMAGE -> Detection.cropped(lane, r.blob());
                default -> throw new LaneDecodeException("Unknown detection source kind: " + kind);
            });
        }
        return new LaneRequest.SubmitDetections(detections);
    }

    private static float[] readVector(WireReader r)
    {
        int dim = r.u16();
        float[] v = new float[dim];
        for (int i = 0; i < dim; i++) {
            v[i] = r.f32();
        }
        return v;
    }

    private static DecisionReport readDecision(WireReader r)
    {
        int n = r.u8();
        if (n == 0) {
            return DecisionReport.empty();
        }

        List<String> ids = new ArrayList<>(n);
        List<LanePhase> phases = new ArrayList<>(n);
        List<Integer> waits = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            ids.add(r.str());
            phases.add(enumAt(LanePhase.values(), r.u8(), "phase"));
            waits.add(r.i32());
        }
        String chosen = r.str();
        SelectionReason reason = enumAt(SelectionReason.values(), r.u8(), "reason");
        double greenTime = r.f64();

        Map<String, LaneReport> lanes = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            String id = ids.get(i);
            lanes.put(id, id.equals(chosen)
                    ? LaneReport.green(waits.get(i), greenTime)
                    : LaneReport.waiting(phases.get(i), waits.get(i)));
        }
        return DecisionReport.of(lanes, chosen, reason, greenTime);
    }

    private static ControllerSnapshot readSnapshot(WireReader r)
    {
        int n = r.u8();
        List<LaneSnapshot> lanes = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            lanes.add(new LaneSnapshot(r.str(), r.i32(), r.i32(), r.i32(),
                    enumAt(LanePhase.values(), r.u8(), "phase")));
        }

        Optional<String> currentGreen = r.bool() ? Optional.of(r.str()) : Optional.empty();
        Optional<Instant> startedAt = r.bool()
                ? Optional.of(Instant.ofEpochSecond(r.i64(), r.i32()))
                : Optional.empty();
        Duration allotted = Duration.ofNanos(r.i64());
        Optional<String> lastEmergency = r.bool() ? Optional.of(r.str()) : Optional.empty();

        return new ControllerSnapshot(lanes, currentGreen, startedAt, allotted, lastEmergency);
    }

    private static LaneResponse.DetectionResult readDetectionResult(WireReader r)
    {
        int n = r.u8();
        List<LaneReading> counts = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            counts.add(new LaneReading(r.str(), r.i32(), r.i32()));
        }
        int fallbacks = r.u16();
        return new LaneResponse.DetectionResult(counts, fallbacks, readDecision(r));
    }

    private static LaneResponse.Pipeline readPipeline(WireReader r)
    {
        boolean classifier = r.bool();
        boolean embedder = r.bool();
        int n = r.u8();
        List<String> errors = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            errors.add(r.longStr());
        }
        return new LaneResponse.Pipeline(new PipelineStatus(classifier, embedder, errors));
    }

    private static <E extends Enum<E>> E enumAt(E[] values, int ordinal, String what)
    {
        if (ordinal >= values.length) {
            throw new LaneDecodeException("Unknown " + what + " value: " + ordinal);
        }
        return values[ordinal];
    }
}
