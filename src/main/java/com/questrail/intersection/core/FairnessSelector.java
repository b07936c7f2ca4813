package com.questrail.intersection.core;

import com.questrail.intersection.config.SignalTimingPolicy;

import java.util.List;
import java.util.Objects;

/**
 * FairnessSelector
 * -----------------------------------------------------------------------------
 * Picks the lane to serve among ordinary traffic.
 *
 * <pre>
 *   score = normal * (1 + wait * waitBoost)
 *   score += STARVATION_BONUS   if wait >= starvationLimit
 * </pre>
 *
 * An empty lane never wins on demand alone, but once a lane has aged to the
 * starvation limit its bonus outweighs any realistic queue. The first lane in
 * registration order achieving the maximum score wins, so an all-zero snapshot
 * selects the first registered lane.
 */
public final class FairnessSelector
{
    static final double STARVATION_BONUS = 1000.0;

    private final SignalTimingPolicy policy;

    public FairnessSelector(SignalTimingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public double score(LaneDemand demand) {
        double score = demand.normal() * (1 + demand.waitCycles() * policy.waitBoost());
        if (demand.waitCycles() >= policy.starvationLimit()) {
            score += STARVATION_BONUS;
        }
        return score;
    }

    /**
     * @param demands working snapshot in registration order (must not be empty)
     * @return index of the chosen lane
     */
    public int select(List<LaneDemand> demands) {
        Objects.requireNonNull(demands, "demands");
        if (demands.isEmpty()) {
            throw new IllegalArgumentException("demands must not be empty");
        }

        int best = 0;
        double bestScore = score(demands.get(0));
        for (int i = 1; i < demands.size(); i++) {
            double s = score(demands.get(i));
            if (s > bestScore) {
                best = i;
                bestScore = s;
            }
        }
        return best;
    }
}
