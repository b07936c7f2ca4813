package com.questrail.intersection.core;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one {@link PhaseTransitioner} application.
 *
 * @param previousGreen lane that held green before the transition, if any
 * @param green         lane holding green after the transition
 * @param startedAt     wall-clock instant the new green phase started
 */
public record PhaseTransition(Optional<String> previousGreen, String green, Instant startedAt)
{
    public PhaseTransition {
        Objects.requireNonNull(previousGreen, "previousGreen");
        Objects.requireNonNull(green, "green");
        Objects.requireNonNull(startedAt, "startedAt");
    }

    public boolean changedLane() {
        return previousGreen.map(p -> !p.equals(green)).orElse(true);
    }
}
