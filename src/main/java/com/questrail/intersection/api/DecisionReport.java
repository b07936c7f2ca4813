package com.questrail.intersection.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DecisionReport
 * -----------------------------------------------------------------------------
 * Result of one decision cycle.
 *
 * <p>The lane map iterates in registration order. When the cycle had at least
 * one lane, exactly one entry is {@link LanePhase#GREEN} and carries the
 * allotted green time; every other entry is {@link LanePhase#RED}.</p>
 *
 * <p>A cycle over an empty lane set yields {@link #empty()}: no lanes, no
 * chosen lane.</p>
 */
public final class DecisionReport
{
    private static final DecisionReport EMPTY =
            new DecisionReport(Map.of(), null, null, 0.0);

    private final Map<String, LaneReport> lanes;
    private final String chosenLane;
    private final SelectionReason reason;
    private final double greenTime;

    private DecisionReport(Map<String, LaneReport> lanes,
                           String chosenLane,
                           SelectionReason reason,
                           double greenTime) {
        this.lanes = Collections.unmodifiableMap(new LinkedHashMap<>(lanes));
        this.chosenLane = chosenLane;
        this.reason = reason;
        this.greenTime = greenTime;
    }

    public static DecisionReport of(Map<String, LaneReport> lanes,
                                    String chosenLane,
                                    SelectionReason reason,
                                    double greenTime) {
        Objects.requireNonNull(lanes, "lanes");
        Objects.requireNonNull(chosenLane, "chosenLane");
        Objects.requireNonNull(reason, "reason");
        if (!lanes.containsKey(chosenLane)) {
            throw new IllegalArgumentException("chosen lane not in report: " + chosenLane);
        }
        return new DecisionReport(lanes, chosenLane, reason, greenTime);
    }

    public static DecisionReport empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return lanes.isEmpty();
    }

    /**
     * Returns the per-lane report, in registration order.
     */
    public Map<String, LaneReport> lanes() {
        return lanes;
    }

    public LaneReport lane(String laneId) {
        LaneReport r = lanes.get(laneId);
        if (r == null) {
            throw new IllegalArgumentException("Unknown lane: " + laneId);
        }
        return r;
    }

    public Optional<String> chosenLane() {
        return Optional.ofNullable(chosenLane);
    }

    public Optional<SelectionReason> reason() {
        return Optional.ofNullable(reason);
    }

    /**
     * Allotted green seconds for the chosen lane; {@code 0.0} for an empty report.
     */
    public double greenTime() {
        return greenTime;
    }

    @Override
    public String toString() {
        return "DecisionReport[chosen=" + chosenLane +
                ", reason=" + reason +
                ", greenTime=" + greenTime +
                ", lanes=" + lanes +
                ']';
    }
}
