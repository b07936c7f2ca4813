package com.questrail.intersection.core;

import com.questrail.intersection.config.SignalTimingPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DemandEvolutionModel
 * -----------------------------------------------------------------------------
 * Synthetic departure/arrival model applied once per cycle to the working
 * snapshot.
 *
 * <ul>
 *   <li>The green lane loses {@code min(normal, floor(clearanceRate * greenTime))}
 *       vehicles.</li>
 *   <li>Every other lane gains whatever the {@link ArrivalGenerator} yields,
 *       saturating at {@link Integer#MAX_VALUE}.</li>
 * </ul>
 *
 * When a live feed supplies counts every cycle, the evolved counts are
 * superseded by the next readings and are visible only through inspection.
 */
public final class DemandEvolutionModel
{
    private final SignalTimingPolicy policy;
    private final ArrivalGenerator arrivals;

    public DemandEvolutionModel(SignalTimingPolicy policy, ArrivalGenerator arrivals) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.arrivals = Objects.requireNonNull(arrivals, "arrivals");
    }

    /**
     * Number of vehicles a lane with {@code normal} queued vehicles clears in
     * {@code greenTime} seconds.
     */
    public int cleared(int normal, double greenTime) {
        return Math.min(normal, (int) Math.floor(policy.clearanceRate() * greenTime));
    }

    /**
     * @return a new snapshot, same order, with evolved {@code normal} counts
     */
    public List<LaneDemand> evolve(List<LaneDemand> snapshot, int greenIndex, double greenTime) {
        Objects.requireNonNull(snapshot, "snapshot");

        List<LaneDemand> out = new ArrayList<>(snapshot.size());
        for (int i = 0; i < snapshot.size(); i++) {
            LaneDemand d = snapshot.get(i);
            if (i == greenIndex) {
                out.add(d.withNormal(d.normal() - cleared(d.normal(), greenTime)));
            }
            else {
                int added = arrivals.arrivals(d.laneId());
                if (added < 0) {
                    throw new IllegalStateException("negative arrivals for lane " + d.laneId());
                }
                out.add(d.withNormal((int) Math.min(Integer.MAX_VALUE, (long) d.normal() + added)));
            }
        }
        return out;
    }
}
