package com.questrail.intersection.protocol.codec;

import com.questrail.intersection.api.*;
import com.questrail.intersection.detection.Detection;
import com.questrail.intersection.detection.PipelineStatus;
import com.questrail.intersection.protocol.LaneMessage;
import com.questrail.intersection.protocol.LaneRequest;
import com.questrail.intersection.protocol.LaneResponse;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LaneMessageCodecTest
 * -----------------------------------------------------------------------------
 * Body layouts of the semantic messages, and rejection of frames that do not
 * match them.
 */
final class LaneMessageCodecTest
{
    private final LaneMessageEncoder encoder = new LaneMessageEncoder();
    private final LaneMessageDecoder decoder = new LaneMessageDecoder();

    private LaneMessage viaWire(LaneMessage message)
    {
        return decoder.decode(encoder.encode(message));
    }

    @Test
    void decideBodyLayout()
    {
        LaneFrame frame = encoder.encode(new LaneRequest.Decide(List.of(LaneReading.of("N", 258, 1))));

        assertEquals(0x01, frame.type());
        assertArrayEquals(new byte[] {
                0x01,               // lane count
                0x01, 'N',          // id
                0x01, 0x02,         // normal = 258
                0x00, 0x01          // emergency = 1
        }, frame.body());
    }

    @Test
    void decideRequestSurvivesWire()
    {
        List<LaneReading> readings = List.of(LaneReading.of("Lane_1", 4, 0), LaneReading.of("Lane_2", 0, 2));

        LaneMessage decoded = viaWire(new LaneRequest.Decide(readings));

        assertEquals(new LaneRequest.Decide(readings), decoded);
    }

    @Test
    void bodylessRequests()
    {
        assertEquals(0, encoder.encode(new LaneRequest.Status()).body().length);
        assertInstanceOf(LaneRequest.Status.class, viaWire(new LaneRequest.Status()));
        assertInstanceOf(LaneRequest.PipelineStatusQuery.class, viaWire(new LaneRequest.PipelineStatusQuery()));
    }

    @Test
    void detectionSourcesSurviveWire()
    {
        LaneRequest.SubmitDetections decoded = (LaneRequest.SubmitDetections) viaWire(
                new LaneRequest.SubmitDetections(List.of(
                        Detection.labeled("A", "ambulance"),
                        Detection.embedded("A", new float[] {0.25f, -1.5f}),
                        Detection.cropped("B", new byte[] {9, 8, 7}),
                        Detection.unclassified(null))));

        List<Detection> d = decoded.detections();
        assertEquals(4, d.size());
        assertEquals(Optional.of("ambulance"), d.get(0).label());
        assertArrayEquals(new float[] {0.25f, -1.5f}, d.get(1).embedding().orElseThrow());
        assertArrayEquals(new byte[] {9, 8, 7}, d.get(2).image().orElseThrow());
        assertEquals(Optional.of("B"), d.get(2).laneId());
        assertTrue(d.get(3).laneId().isEmpty());
        assertTrue(d.get(3).label().isEmpty());
    }

    @Test
    void decisionResponseKeepsGreenTimeOnChosenLaneOnly()
    {
        Map<String, LaneReport> lanes = new LinkedHashMap<>();
        lanes.put("A", LaneReport.waiting(LanePhase.RED, 4));
        lanes.put("B", LaneReport.green(0, 7.5));
        DecisionReport report = DecisionReport.of(lanes, "B", SelectionReason.EMERGENCY, 7.5);

        DecisionReport decoded = ((LaneResponse.Decision) viaWire(new LaneResponse.Decision(report))).report();

        assertEquals(List.of("A", "B"), List.copyOf(decoded.lanes().keySet()));
        assertEquals(Optional.of("B"), decoded.chosenLane());
        assertEquals(Optional.of(SelectionReason.EMERGENCY), decoded.reason());
        assertEquals(7.5, decoded.greenTime());
        assertEquals(lanes.get("A"), decoded.lane("A"));
        assertEquals(lanes.get("B"), decoded.lane("B"));
    }

    @Test
    void emptyDecisionIsOneByte()
    {
        LaneFrame frame = encoder.encode(new LaneResponse.Decision(DecisionReport.empty()));

        assertArrayEquals(new byte[] {0x00}, frame.body());
        assertTrue(((LaneResponse.Decision) decoder.decode(frame)).report().isEmpty());
    }

    @Test
    void statusResponseSurvivesWire()
    {
        ControllerSnapshot snapshot = new ControllerSnapshot(
                List.of(new LaneSnapshot("A", 3, 0, 0, LanePhase.GREEN),
                        new LaneSnapshot("B", 5, 1, 2, LanePhase.RED)),
                Optional.of("A"),
                Optional.of(Instant.parse("2024-05-01T08:00:00.123456789Z")),
                Duration.ofMillis(4_250),
                Optional.of("A"));

        assertEquals(new LaneResponse.Status(snapshot), viaWire(new LaneResponse.Status(snapshot)));
        assertEquals(new LaneResponse.Status(ControllerSnapshot.empty()),
                viaWire(new LaneResponse.Status(ControllerSnapshot.empty())));
    }

    @Test
    void pipelineAndFailureResponsesSurviveWire()
    {
        LaneResponse.Pipeline pipeline = new LaneResponse.Pipeline(
                new PipelineStatus(true, false, List.of("embedder load: missing weights")));
        LaneResponse.Failure failure = new LaneResponse.Failure(
                LaneResponse.ErrorCode.INVALID_REQUEST, "Duplicate lane id in readings: A");

        assertEquals(pipeline, viaWire(pipeline));
        assertEquals(failure, viaWire(failure));
    }

    @Test
    void unknownTypeIsRejected()
    {
        assertThrows(LaneDecodeException.class, () -> decoder.decode(new LaneFrame(0x7F, new byte[0])));
    }

    @Test
    void truncatedBodyIsRejected()
    {
        byte[] body = encoder.encode(new LaneRequest.Decide(List.of(LaneReading.of("A", 1, 1)))).body();
        byte[] truncated = java.util.Arrays.copyOf(body, body.length - 1);

        assertThrows(LaneDecodeException.class, () -> decoder.decode(new LaneFrame(0x01, truncated)));
    }

    @Test
    void trailingBytesAreRejected()
    {
        assertThrows(LaneDecodeException.class, () -> decoder.decode(new LaneFrame(0x02, new byte[] {0})));
    }

    @Test
    void blankLaneIdIsRejected()
    {
        byte[] body = {0x01, 0x00, 0x00, 0x01, 0x00, 0x00};
        assertThrows(LaneDecodeException.class, () -> decoder.decode(new LaneFrame(0x01, body)));
    }

    @Test
    void unknownPhaseOrdinalIsRejected()
    {
        byte[] body = {0x01, 0x01, 'A', 0x09, 0, 0, 0, 0, 0x01, 'A', 0x00, 0, 0, 0, 0, 0, 0, 0, 0};
        assertThrows(LaneDecodeException.class, () -> decoder.decode(new LaneFrame(0x81, body)));
    }

    @Test
    void countsBeyondWireWidthCannotBeEncoded()
    {
        LaneRequest.Decide tooMany = new LaneRequest.Decide(List.of(LaneReading.of("A", 70_000, 0)));
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(tooMany));
    }
}
