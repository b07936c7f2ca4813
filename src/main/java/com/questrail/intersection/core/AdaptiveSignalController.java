package com.questrail.intersection.core;

import com.questrail.intersection.api.*;
import com.questrail.intersection.config.SignalTimingPolicy;
import com.questrail.intersection.observability.DecisionEvent;
import com.questrail.intersection.observability.LaneSetChangedEvent;
import com.questrail.intersection.observability.NullObservabilitySink;
import com.questrail.intersection.observability.SignalObservabilitySink;
import com.questrail.intersection.time.MonotonicClock;
import com.questrail.intersection.time.SystemMonotonicClock;
import com.questrail.intersection.time.SystemWallClock;
import com.questrail.intersection.time.WallClock;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * AdaptiveSignalController
 * -----------------------------------------------------------------------------
 * The decision loop: one {@link #decide(List)} call is one signal cycle.
 *
 * <h2>Cycle</h2>
 * <ol>
 *   <li>Merge the readings with each lane's retained aging counter.</li>
 *   <li>Emergency preemption via {@link EmergencySelector}.</li>
 *   <li>Otherwise hold the current green while its allotted time has not
 *       elapsed, or score lanes via {@link FairnessSelector}.</li>
 *   <li>Reset the chosen lane's aging counter; age every other lane by one.</li>
 *   <li>Allot green time via {@link GreenTimeEstimator}.</li>
 *   <li>Relabel phases via {@link PhaseTransitioner}.</li>
 *   <li>Evolve queue counts via {@link DemandEvolutionModel}.</li>
 *   <li>Report phase and aging for every lane.</li>
 * </ol>
 *
 * Selection, green time and evolution are computed on a working snapshot
 * before any stored state changes, so a cycle that throws leaves the
 * controller as it was.
 *
 * Green time is estimated from the chosen lane's aging counter as it stood
 * before the reset in step 4.
 *
 * <h2>Lane set changes</h2>
 * A call whose lane-id set differs from the registered one discards all state
 * (aging, phases, current green, emergency memory) and registers the new lanes
 * in the order supplied. The cycle then runs on the fresh state.
 *
 * <h2>Threading model</h2>
 * A single private lock protects all mutable state, so concurrent callers are
 * serialized. Observability callbacks run after the lock is released.
 */
public final class AdaptiveSignalController implements SignalController
{
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final Object lock = new Object();

    private final SignalTimingPolicy policy;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SignalObservabilitySink sink;

    private final EmergencySelector emergencySelector = new EmergencySelector();
    private final FairnessSelector fairnessSelector;
    private final GreenTimeEstimator greenTimeEstimator;
    private final PhaseTransitioner phaseTransitioner;
    private final DemandEvolutionModel demandModel;

    private final LaneStateStore lanes = new LaneStateStore();

    private String currentGreen;
    private long greenStartedNanos;
    private Instant greenStartedAt;
    private double allottedGreen;
    private OptionalInt lastEmergencyIndex = OptionalInt.empty();

    private AdaptiveSignalController(SignalTimingPolicy policy,
                                     ArrivalGenerator arrivals,
                                     MonotonicClock clock,
                                     WallClock wallClock,
                                     SignalObservabilitySink sink,
                                     List<String> initialLanes) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.fairnessSelector = new FairnessSelector(policy);
        this.greenTimeEstimator = new GreenTimeEstimator(policy);
        this.phaseTransitioner = new PhaseTransitioner(wallClock);
        this.demandModel = new DemandEvolutionModel(policy, Objects.requireNonNull(arrivals, "arrivals"));

        this.allottedGreen = policy.minGreen();
        lanes.register(initialLanes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public SignalTimingPolicy policy() {
        return policy;
    }

    @Override
    public DecisionReport decide(List<LaneReading> readings) {
        Objects.requireNonNull(readings, "readings");

        Map<String, LaneReading> byLane = new LinkedHashMap<>();
        for (LaneReading r : readings) {
            Objects.requireNonNull(r, "reading");
            if (byLane.put(r.laneId(), r) != null) {
                throw new IllegalArgumentException("Duplicate lane id in readings: " + r.laneId());
            }
        }

        final LaneSetChangedEvent laneSetChange;
        final DecisionEvent decision;

        synchronized (lock) {
            if (!lanes.hasLaneSet(byLane.keySet())) {
                List<String> previous = lanes.laneIds();
                reregisterLocked(new ArrayList<>(byLane.keySet()));
                laneSetChange = new LaneSetChangedEvent(wallClock.now(), previous, lanes.laneIds());
            }
            else {
                laneSetChange = null;
            }

            decision = lanes.isEmpty() ? null : runCycleLocked(byLane);
        }

        if (laneSetChange != null) {
            sink.onLaneSetChanged(laneSetChange);
        }
        if (decision == null) {
            return DecisionReport.empty();
        }
        sink.onDecision(decision);
        return decision.report();
    }

    @Override
    public ControllerSnapshot inspect() {
        synchronized (lock) {
            List<LaneSnapshot> snap = new ArrayList<>(lanes.size());
            for (LaneState s : lanes.inOrder()) {
                snap.add(s.toSnapshot());
            }
            return new ControllerSnapshot(
                    snap,
                    Optional.ofNullable(currentGreen),
                    Optional.ofNullable(greenStartedAt),
                    toDuration(allottedGreen),
                    lastEmergencyIndex.isPresent()
                            ? Optional.of(lanes.idAt(lastEmergencyIndex.getAsInt()))
                            : Optional.empty()
            );
        }
    }

    // ------------------------
    // Cycle steps
    // ------------------------

    private DecisionEvent runCycleLocked(Map<String, LaneReading> byLane) {
        final long now = clock.nowNanos();
        final List<LaneState> current = lanes.inOrder();

        // 1) Merge: readings are authoritative for counts, aging is retained.
        List<LaneDemand> working = new ArrayList<>(current.size());
        for (LaneState s : current) {
            LaneReading r = byLane.get(s.laneId());
            working.add(new LaneDemand(s.laneId(), r.normal(), r.emergency(), s.waitCycles()));
        }

        // 2-3) Select.
        final int chosen;
        final SelectionReason reason;
        OptionalInt emergency = emergencySelector.select(working, lastEmergencyIndex);
        if (emergency.isPresent()) {
            chosen = emergency.getAsInt();
            reason = SelectionReason.EMERGENCY;
        }
        else if (currentGreen != null && !greenExpiredLocked(now)) {
            chosen = lanes.indexOf(currentGreen);
            reason = SelectionReason.HOLD;
        }
        else {
            chosen = fairnessSelector.select(working);
            reason = SelectionReason.FAIRNESS;
        }
        final String chosenLane = lanes.idAt(chosen);

        // 5) Green time, from the pre-reset snapshot.
        final double greenTime = greenTimeEstimator.estimate(working.get(chosen));

        // 7) Demand evolution, still on the working snapshot. Stored state is untouched up to here.
        final List<LaneDemand> evolved = demandModel.evolve(working, chosen, greenTime);

        // Commit: evolved counts become the stored queue lengths, plus aging (4).
        for (int i = 0; i < current.size(); i++) {
            LaneState next = current.get(i).withCounts(evolved.get(i).normal(), working.get(i).emergency());
            lanes.put(i == chosen ? next.withWaitReset() : next.withWaitIncremented());
        }
        if (emergency.isPresent()) {
            lastEmergencyIndex = emergency;
        }
        allottedGreen = greenTime;

        // 6) Phase labels.
        PhaseTransition transition = phaseTransitioner.apply(lanes, chosenLane);
        currentGreen = chosenLane;
        greenStartedNanos = now;
        greenStartedAt = transition.startedAt();

        // 8) Report.
        Map<String, LaneReport> report = new LinkedHashMap<>();
        for (LaneState s : lanes.inOrder()) {
            report.put(s.laneId(), s.laneId().equals(chosenLane)
                    ? LaneReport.green(s.waitCycles(), greenTime)
                    : LaneReport.waiting(s.phase(), s.waitCycles()));
        }

        return new DecisionEvent(
                transition.startedAt(),
                DecisionReport.of(report, chosenLane, reason, greenTime),
                transition.changedLane());
    }

    private boolean greenExpiredLocked(long nowNanos) {
        long elapsed = nowNanos - greenStartedNanos;
        return elapsed >= (long) (allottedGreen * NANOS_PER_SECOND);
    }

    private void reregisterLocked(List<String> laneIds) {
        lanes.register(laneIds);
        currentGreen = null;
        greenStartedNanos = 0L;
        greenStartedAt = null;
        allottedGreen = policy.minGreen();
        lastEmergencyIndex = OptionalInt.empty();
    }

    private static Duration toDuration(double seconds) {
        return Duration.ofNanos((long) (seconds * NANOS_PER_SECOND));
    }

    public static final class Builder {
        private SignalTimingPolicy policy = SignalTimingPolicy.defaults();
        private ArrivalGenerator arrivals;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private SignalObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private List<String> lanes = List.of();

        public Builder withPolicy(SignalTimingPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder withArrivalGenerator(ArrivalGenerator arrivals) {
            this.arrivals = arrivals;
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

        public Builder withObservabilitySink(SignalObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        /**
         * Pre-registers lanes, in order. Without it the first {@code decide}
         * call registers its own lanes.
         */
        public Builder withLanes(List<String> laneIds) {
            this.lanes = List.copyOf(laneIds);
            return this;
        }

        public Builder withLanes(String... laneIds) {
            return withLanes(Arrays.asList(laneIds));
        }

        public AdaptiveSignalController build() {
            ArrivalGenerator a = (arrivals != null) ? arrivals : UniformArrivalGenerator.unseeded();
            return new AdaptiveSignalController(policy, a, clock, wallClock, sink, lanes);
        }
    }
}
