package com.questrail.intersection.core;

import com.questrail.intersection.api.LanePhase;
import com.questrail.intersection.time.WallClock;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * PhaseTransitioner
 * -----------------------------------------------------------------------------
 * Applies the red / yellow / green labeling for a newly chosen lane.
 *
 * <h2>Transition</h2>
 * <ol>
 *   <li>Every lane is set to {@link LanePhase#RED}.</li>
 *   <li>The chosen lane is set to {@link LanePhase#YELLOW}.</li>
 *   <li>The chosen lane is immediately overwritten to {@link LanePhase#GREEN}
 *       and the current instant is recorded as the green start.</li>
 * </ol>
 *
 * Yellow is therefore never observable with a nonzero duration. The policy's
 * {@code yellowTime} does not gate this transition.
 */
public final class PhaseTransitioner
{
    private final WallClock wallClock;

    public PhaseTransitioner(WallClock wallClock) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public PhaseTransition apply(LaneStateStore store, String chosenLane) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(chosenLane, "chosenLane");

        Optional<String> previous = Optional.empty();
        for (LaneState s : store.inOrder()) {
            if (s.phase() == LanePhase.GREEN) {
                previous = Optional.of(s.laneId());
            }
            store.put(s.withPhase(LanePhase.RED));
        }

        LaneState chosen = store.get(chosenLane);
        store.put(chosen.withPhase(LanePhase.YELLOW));
        store.put(store.get(chosenLane).withPhase(LanePhase.GREEN));

        Instant startedAt = wallClock.now();
        return new PhaseTransition(previous, chosenLane, startedAt);
    }
}
