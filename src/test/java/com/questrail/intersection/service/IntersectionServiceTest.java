package com.questrail.intersection.service;

import com.questrail.intersection.api.ControllerSnapshot;
import com.questrail.intersection.api.DecisionReport;
import com.questrail.intersection.api.LaneReading;
import com.questrail.intersection.detection.Detection;
import com.questrail.intersection.detection.DetectionAggregator;
import com.questrail.intersection.detection.PipelineStatus;
import com.questrail.intersection.observability.LaneSetChangedEvent;
import com.questrail.intersection.observability.RecordingObservabilitySink;
import com.questrail.intersection.observability.SignalErrorEvent;
import com.questrail.intersection.protocol.LaneRequest;
import com.questrail.intersection.protocol.LaneResponse;
import com.questrail.intersection.time.FixedWallClock;
import com.questrail.intersection.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IntersectionServiceTest {

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ManualMonotonicClock clock = new ManualMonotonicClock();

    private IntersectionService.Builder service() {
        return IntersectionService.builder()
                .withArrivalGenerator(laneId -> 0)
                .withClock(clock)
                .withWallClock(new FixedWallClock())
                .withObservabilitySink(sink);
    }

    @Test
    void statusIsEmptyBeforeFirstUpdate() {
        assertEquals(ControllerSnapshot.empty(), service().build().status());
    }

    @Test
    void updateUsesHostTiming() {
        IntersectionService s = service().build();

        DecisionReport r = s.update(List.of(
                LaneReading.of("A", 0, 0), LaneReading.of("B", 2, 0),
                LaneReading.of("C", 0, 0), LaneReading.of("D", 0, 0)));

        assertEquals(Optional.of("B"), r.chosenLane());
        assertEquals(3.0, r.greenTime(), 1e-9);
        assertEquals(Optional.of("B"), s.status().currentGreen());
        assertEquals(4, s.status().lanes().size());
    }

    @Test
    void laneSetChangesAreReportedOncePerChange() {
        IntersectionService s = service().build();

        s.update(List.of(LaneReading.of("A", 1, 0), LaneReading.of("B", 0, 0)));
        s.update(List.of(LaneReading.of("B", 0, 0), LaneReading.of("A", 1, 0)));
        s.update(List.of(LaneReading.of("A", 1, 0), LaneReading.of("B", 0, 0), LaneReading.of("C", 0, 0)));

        List<LaneSetChangedEvent> changes = sink.eventsOfType(LaneSetChangedEvent.class);
        assertEquals(2, changes.size());
        assertEquals(List.of(), changes.get(0).previousLanes());
        assertEquals(List.of("A", "B", "C"), changes.get(1).newLanes());
    }

    @Test
    void detectionsAreAggregatedThenDecided() {
        IntersectionService s = service().withLoadErrors(List.of("classifier load: no model")).build();

        DetectionOutcome outcome = s.submitDetections(List.of(
                Detection.labeled("North", "car"),
                Detection.labeled("South", "ambulance"),
                Detection.embedded("North", new float[] {1f})));

        assertEquals(List.of(LaneReading.of("North", 2, 0), LaneReading.of("South", 0, 1)),
                outcome.aggregation().readings());
        assertEquals(1, outcome.aggregation().fallbacks());
        assertEquals(Optional.of("South"), outcome.report().chosenLane());
        assertEquals(List.of("classifier load: no model"), outcome.warnings());
    }

    @Test
    void pipelineStatusReflectsInstalledSeams() {
        IntersectionService s = service()
                .withAggregator(new DetectionAggregator(v -> "car", null))
                .withLoadErrors(List.of("embedder load: missing"))
                .build();

        assertEquals(new PipelineStatus(true, false, List.of("embedder load: missing")), s.pipelineStatus());
    }

    @Test
    void handleServesEveryRequestKind() {
        IntersectionService s = service().build();

        LaneResponse decided = s.handle(new LaneRequest.Decide(List.of(LaneReading.of("A", 3, 0))));
        assertEquals(Optional.of("A"), ((LaneResponse.Decision) decided).report().chosenLane());

        LaneResponse status = s.handle(new LaneRequest.Status());
        assertEquals(Optional.of("A"), ((LaneResponse.Status) status).snapshot().currentGreen());

        LaneResponse detected = s.handle(new LaneRequest.SubmitDetections(List.of(Detection.unclassified("A"))));
        LaneResponse.DetectionResult result = (LaneResponse.DetectionResult) detected;
        assertEquals(List.of(LaneReading.of("A", 1, 0)), result.counts());
        assertEquals(1, result.fallbacks());

        LaneResponse pipeline = s.handle(new LaneRequest.PipelineStatusQuery());
        assertFalse(((LaneResponse.Pipeline) pipeline).status().classifierLoaded());
    }

    @Test
    void duplicateLanesBecomeInvalidRequest() {
        IntersectionService s = service().build();

        LaneResponse r = s.handle(new LaneRequest.Decide(List.of(
                LaneReading.of("A", 1, 0), LaneReading.of("A", 2, 0))));

        LaneResponse.Failure failure = assertInstanceOf(LaneResponse.Failure.class, r);
        assertEquals(LaneResponse.ErrorCode.INVALID_REQUEST, failure.code());
        assertFalse(sink.hasEventOfType(SignalErrorEvent.class));
    }

    @Test
    void unexpectedFailureBecomesInternalErrorAndIsReported() {
        IntersectionService s = service().withArrivalGenerator(laneId -> -1).build();

        LaneResponse r = s.handle(new LaneRequest.Decide(List.of(
                LaneReading.of("A", 1, 0), LaneReading.of("B", 0, 0))));

        LaneResponse.Failure failure = assertInstanceOf(LaneResponse.Failure.class, r);
        assertEquals(LaneResponse.ErrorCode.INTERNAL, failure.code());
        assertTrue(sink.hasEventOfType(SignalErrorEvent.class));
    }

    @Test
    void detectionsNamingTooManyLanesAreRejectedBeforeDeciding() {
        IntersectionService s = service().build();
        s.update(List.of(LaneReading.of("A", 1, 0)));

        List<Detection> detections = new ArrayList<>();
        for (int i = 0; i <= IntersectionService.MAX_LANES; i++) {
            detections.add(Detection.labeled("Lane_" + i, "car"));
        }
        LaneResponse r = s.handle(new LaneRequest.SubmitDetections(detections));

        LaneResponse.Failure failure = assertInstanceOf(LaneResponse.Failure.class, r);
        assertEquals(LaneResponse.ErrorCode.INVALID_REQUEST, failure.code());
        assertEquals(1, s.status().lanes().size());
        assertEquals(1, sink.eventsOfType(LaneSetChangedEvent.class).size());
        assertFalse(sink.hasEventOfType(SignalErrorEvent.class));
    }

    @Test
    void readingsAtTheLaneLimitAreAccepted() {
        IntersectionService s = service().build();

        List<LaneReading> readings = new ArrayList<>();
        for (int i = 0; i < IntersectionService.MAX_LANES; i++) {
            readings.add(LaneReading.of("Lane_" + i, 0, 0));
        }

        assertEquals(IntersectionService.MAX_LANES, s.update(readings).lanes().size());
        readings.add(LaneReading.of("Lane_" + IntersectionService.MAX_LANES, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> s.update(readings));
    }
}
