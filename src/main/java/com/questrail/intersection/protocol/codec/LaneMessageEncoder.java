package com.questrail.intersection.protocol.codec;

import com.questrail.intersection.api.*;
import com.questrail.intersection.detection.Detection;
import com.questrail.intersection.detection.PipelineStatus;
import com.questrail.intersection.protocol.LaneMessage;
import com.questrail.intersection.protocol.LaneRequest;
import com.questrail.intersection.protocol.LaneResponse;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.questrail.intersection.protocol.codec.LaneMessageType.*;

/**
 * LaneMessageEncoder
 * ============================================================================
 * Converts a semantic {@link LaneMessage} into a wire-adjacent {@link LaneFrame}.
 *
 * <pre>
 *   LaneMessage  ->  LaneFrame  ->  byte[]
 *       (this)       (LaneFrameCodec)
 * </pre>
 *
 * <h2>Body layouts</h2>
 * All integers are big-endian; {@code str} is {@code u8 length + UTF-8},
 * {@code lstr} is {@code u16 length + UTF-8}.
 * <ul>
 *   <li>Decide: {@code u8 n, n * (str id, u16 normal, u16 emergency)}</li>
 *   <li>Detections: {@code u16 n, n * (bool hasLane, [str lane], u8 kind, source)}
 *       where source is {@code str label}, {@code u16 dim, dim * f32}, or
 *       {@code u16 len, bytes}</li>
 *   <li>Decision: {@code u8 n, n * (str id, u8 phase, i32 wait)}, then if
 *       {@code n > 0}: {@code str chosen, u8 reason, f64 greenTime}</li>
 *   <li>Status: {@code u8 n, n * (str id, i32 normal, i32 emergency, i32 wait, u8 phase)},
 *       optional current green, optional green start (i64 seconds, i32 nanos),
 *       i64 allotted nanos, optional last emergency lane</li>
 * </ul>
 *
 * Encoding never fails on a valid message except when a field does not fit
 * its wire width, which throws {@link IllegalArgumentException}.
 */
public final class LaneMessageEncoder
{
    public LaneFrame encode(LaneMessage message)
    {
        Objects.requireNonNull(message, "message");

        WireWriter w = new WireWriter();
        final int type;

        if (message instanceof LaneRequest.Decide m) {
            type = DECIDE;
            w.u8(m.readings().size());
            for (LaneReading r : m.readings()) {
                w.str(r.laneId()).u16(r.normal()).u16(r.emergency());
            }
        }
        else if (message instanceof LaneRequest.Status) {
            type = STATUS;
        }
        else if (message instanceof LaneRequest.SubmitDetections m) {
            type = DETECTIONS;
            w.u16(m.detections().size());
            for (Detection d : m.detections()) {
                writeDetection(w, d);
            }
        }
        else if (message instanceof LaneRequest.PipelineStatusQuery) {
            type = PIPELINE_STATUS;
        }
        else if (message instanceof LaneResponse.Decision m) {
            type = DECISION_RESPONSE;
            writeDecision(w, m.report());
        }
        else if (message instanceof LaneResponse.Status m) {
            type = STATUS_RESPONSE;
            writeSnapshot(w, m.snapshot());
        }
        else if (message instanceof LaneResponse.DetectionResult m) {
            type = DETECTION_RESULT_RESPONSE;
            w.u8(m.counts().size());
            for (LaneReading r : m.counts()) {
                w.str(r.laneId()).i32(r.normal()).i32(r.emergency());
            }
            w.u16(m.fallbacks());
            writeDecision(w, m.report());
        }
        else if (message instanceof LaneResponse.Pipeline m) {
            type = PIPELINE_STATUS_RESPONSE;
            PipelineStatus s = m.status();
            w.bool(s.classifierLoaded()).bool(s.embedderLoaded()).u8(s.loadErrors().size());
            for (String e : s.loadErrors()) {
                w.longStr(e);
            }
        }
        else if (message instanceof LaneResponse.Failure m) {
            type = FAILURE_RESPONSE;
            w.u8(m.code().wireValue()).longStr(m.message());
        }
        else {
            throw new IllegalArgumentException("Unsupported message type: " + message.getClass().getName());
        }

        return new LaneFrame(type, w.toByteArray());
    }

    private static void writeDetection(WireWriter w, Detection d)
    {
        Optional<String> lane = d.laneId();
        w.bool(lane.isPresent());
        lane.ifPresent(w::str);

        Optional<String> label = d.label();
        Optional<float[]> embedding = d.embedding();
        Optional<byte[]> image = d.image();

        if (label.isPresent()) {
            w.u8(SOURCE_LABEL).str(label.get());
        }
        else if (embedding.isPresent()) {
            float[] v = embedding.get();
            w.u8(SOURCE_EMBEDDING).u16(v.length);
            for (float f : v) {
                w.f32(f);
            }
        }
        else if (image.isPresent()) {
            w.u8(SOURCE_IMAGE).blob(image.get());
        }
        else {
            w.u8(SOURCE_NONE);
        }
    }

    private static void writeDecision(WireWriter w, DecisionReport report)
    {
        w.u8(report.lanes().size());
        for (Map.Entry<String, LaneReport> e : report.lanes().entrySet()) {
            w.str(e.getKey()).u8(e.getValue().phase().ordinal()).i32(e.getValue().waitCycles());
        }
        if (!report.isEmpty()) {
            w.str(report.chosenLane().orElseThrow())
             .u8(report.reason().orElseThrow().ordinal())
             .f64(report.greenTime());
        }
    }

    private static void writeSnapshot(WireWriter w, ControllerSnapshot s)
    {
        w.u8(s.lanes().size());
        for (LaneSnapshot l : s.lanes()) {
            w.str(l.laneId())
             .i32(l.normal())
             .i32(l.emergency())
             .i32(l.waitCycles())
             .u8(l.phase().ordinal());
        }

        w.bool(s.currentGreen().isPresent());
        s.currentGreen().ifPresent(w::str);

        w.bool(s.greenStartedAt().isPresent());
        if (s.greenStartedAt().isPresent()) {
            Instant t = s.greenStartedAt().get();
            w.i64(t.getEpochSecond()).i32(t.getNano());
        }

        w.i64(s.allottedGreen().toNanos());

        w.bool(s.lastEmergencyLane().isPresent());
        s.lastEmergencyLane().ifPresent(w::str);
    }
}
