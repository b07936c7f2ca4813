package com.questrail.intersection.core;

import com.questrail.intersection.config.SignalTimingPolicy;

import java.util.Objects;

/**
 * GreenTimeEstimator
 * -----------------------------------------------------------------------------
 * Computes how long the chosen lane stays green.
 *
 * <pre>
 *   raw = normal / clearanceRate
 *       + wait * WAIT_BONUS_SECONDS
 *       + emergency * EMERGENCY_BONUS_SECONDS
 *   green = clamp(raw, minGreen, maxGreen)
 * </pre>
 *
 * The per-cycle wait bonus is a fixed constant and is tuned separately from
 * the policy's {@code waitBoost}, which only affects lane scoring.
 */
public final class GreenTimeEstimator
{
    static final double WAIT_BONUS_SECONDS = 0.4;
    static final double EMERGENCY_BONUS_SECONDS = 2.0;

    private final SignalTimingPolicy policy;

    public GreenTimeEstimator(SignalTimingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public double estimate(LaneDemand demand) {
        Objects.requireNonNull(demand, "demand");

        double clear = demand.normal() / policy.clearanceRate();
        double waitBonus = demand.waitCycles() * WAIT_BONUS_SECONDS;
        double emergencyBonus = demand.emergency() * EMERGENCY_BONUS_SECONDS;

        double raw = clear + waitBonus + emergencyBonus;
        return Math.max(policy.minGreen(), Math.min(raw, policy.maxGreen()));
    }
}
