package com.questrail.intersection.service;

import com.questrail.intersection.api.ControllerSnapshot;
import com.questrail.intersection.api.DecisionReport;
import com.questrail.intersection.api.LaneReading;
import com.questrail.intersection.api.SignalController;
import com.questrail.intersection.config.SignalTimingPolicy;
import com.questrail.intersection.core.AdaptiveSignalController;
import com.questrail.intersection.core.ArrivalGenerator;
import com.questrail.intersection.detection.AggregationResult;
import com.questrail.intersection.detection.Detection;
import com.questrail.intersection.detection.DetectionAggregator;
import com.questrail.intersection.detection.PipelineStatus;
import com.questrail.intersection.observability.NullObservabilitySink;
import com.questrail.intersection.observability.SignalErrorEvent;
import com.questrail.intersection.observability.SignalObservabilitySink;
import com.questrail.intersection.protocol.LaneRequest;
import com.questrail.intersection.protocol.LaneResponse;
import com.questrail.intersection.time.MonotonicClock;
import com.questrail.intersection.time.SystemMonotonicClock;
import com.questrail.intersection.time.SystemWallClock;
import com.questrail.intersection.time.WallClock;

import java.util.List;
import java.util.Objects;

/**
 * IntersectionService
 * =============================================================================
 * Hosts exactly one {@link SignalController} and the detection pipeline that
 * feeds it.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Serialize all access to the controller.</li>
 *   <li>Turn detection batches into lane readings before deciding.</li>
 *   <li>Answer the request vocabulary in {@link LaneRequest} via {@link #handle(LaneRequest)}.</li>
 * </ul>
 *
 * Lane-set changes are reported by the hosted controller through the shared
 * {@link SignalObservabilitySink}, so every re-registration seen by the service
 * produces exactly one {@code LaneSetChangedEvent}.
 *
 * <p>This class has no transport knowledge. The UDP runtime, the simulation
 * CLI and tests all drive it through the same methods.</p>
 */
public final class IntersectionService
{
    /**
     * Largest lane set the host accepts; every reply lists its lanes behind a
     * one-byte count.
     */
    public static final int MAX_LANES = 255;

    private final Object lock = new Object();

    private final SignalController controller;
    private final DetectionAggregator aggregator;
    private final List<String> loadErrors;
    private final SignalObservabilitySink sink;
    private final WallClock wallClock;

    private boolean updated;

    private IntersectionService(SignalController controller,
                                DetectionAggregator aggregator,
                                List<String> loadErrors,
                                SignalObservabilitySink sink,
                                WallClock wallClock) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.loadErrors = List.copyOf(loadErrors);
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs one decision cycle on caller-supplied readings.
     *
     * @throws IllegalArgumentException if the readings repeat a lane id or name
     *         more than {@link #MAX_LANES} lanes
     */
    public DecisionReport update(List<LaneReading> readings) {
        Objects.requireNonNull(readings, "readings");
        requireLaneLimit(readings.size());
        synchronized (lock) {
            DecisionReport report = controller.decide(readings);
            updated = true;
            return report;
        }
    }

    /**
     * Returns the controller's full state; an empty snapshot before the first
     * {@link #update(List)}.
     */
    public ControllerSnapshot status() {
        synchronized (lock) {
            return updated ? controller.inspect() : ControllerSnapshot.empty();
        }
    }

    public DetectionOutcome submitDetections(List<Detection> detections) {
        Objects.requireNonNull(detections, "detections");
        synchronized (lock) {
            AggregationResult aggregation = aggregator.aggregate(detections);
            requireLaneLimit(aggregation.readings().size());
            DecisionReport report = update(aggregation.readings());
            return new DetectionOutcome(aggregation, report, loadErrors);
        }
    }

    private static void requireLaneLimit(int lanes) {
        if (lanes > MAX_LANES) {
            throw new IllegalArgumentException("Too many lanes: " + lanes + " (max " + MAX_LANES + ")");
        }
    }

    public PipelineStatus pipelineStatus() {
        return new PipelineStatus(aggregator.hasClassifier(), aggregator.hasEmbedder(), loadErrors);
    }

    /**
     * Serves one request. Never throws: contract violations become
     * {@link LaneResponse.ErrorCode#INVALID_REQUEST}, anything else
     * {@link LaneResponse.ErrorCode#INTERNAL} and is reported to the sink.
     */
    public LaneResponse handle(LaneRequest request) {
        Objects.requireNonNull(request, "request");
        try {
            if (request instanceof LaneRequest.Decide r) {
                return new LaneResponse.Decision(update(r.readings()));
            }
            if (request instanceof LaneRequest.Status) {
                return new LaneResponse.Status(status());
            }
            if (request instanceof LaneRequest.SubmitDetections r) {
                DetectionOutcome outcome = submitDetections(r.detections());
                return new LaneResponse.DetectionResult(
                        outcome.aggregation().readings(),
                        outcome.aggregation().fallbacks(),
                        outcome.report());
            }
            if (request instanceof LaneRequest.PipelineStatusQuery) {
                return new LaneResponse.Pipeline(pipelineStatus());
            }
            throw new IllegalStateException("Unhandled request type: " + request.getClass().getName());
        }
        catch (IllegalArgumentException e) {
            return new LaneResponse.Failure(LaneResponse.ErrorCode.INVALID_REQUEST, String.valueOf(e.getMessage()));
        }
        catch (RuntimeException e) {
            sink.onError(new SignalErrorEvent(wallClock.now(), "Request failed: " + request, e));
            return new LaneResponse.Failure(LaneResponse.ErrorCode.INTERNAL,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public static final class Builder {
        private SignalTimingPolicy policy = SignalTimingPolicy.hostDefaults();
        private ArrivalGenerator arrivals;
        private DetectionAggregator aggregator;
        private SignalObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private List<String> loadErrors = List.of();

        public Builder withPolicy(SignalTimingPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder withArrivalGenerator(ArrivalGenerator arrivals) {
            this.arrivals = arrivals;
            return this;
        }

        /**
         * Installs the detection pipeline. Defaults to a labels-only aggregator
         * reporting to this service's sink.
         */
        public Builder withAggregator(DetectionAggregator aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder withObservabilitySink(SignalObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Problems met while the classification seams were set up; surfaced by
         * {@link #pipelineStatus()} and as warnings on detection outcomes.
         */
        public Builder withLoadErrors(List<String> loadErrors) {
            this.loadErrors = List.copyOf(loadErrors);
            return this;
        }

        public IntersectionService build() {
            AdaptiveSignalController.Builder controller = AdaptiveSignalController.builder()
                    .withPolicy(policy)
                    .withClock(clock)
                    .withWallClock(wallClock)
                    .withObservabilitySink(sink);
            if (arrivals != null) {
                controller.withArrivalGenerator(arrivals);
            }

            DetectionAggregator a = (aggregator != null)
                    ? aggregator
                    : new DetectionAggregator(null, null, sink, wallClock);

            return new IntersectionService(controller.build(), a, loadErrors, sink, wallClock);
        }
    }
}
