package com.questrail.intersection.core;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * EmergencySelector
 * -----------------------------------------------------------------------------
 * Picks the lane to serve when any lane reports emergency traffic.
 *
 * <p>The lane with the highest emergency count wins. Lanes tied at that
 * maximum are resolved by a circular scan of registration order that starts
 * immediately after the lane last granted green for an emergency, so
 * persistently tied lanes take turns.</p>
 *
 * <p>Pure: the caller owns the "last emergency lane" memory and must update it
 * to the returned index.</p>
 */
public final class EmergencySelector
{
    /**
     * @param demands            working snapshot in registration order
     * @param lastEmergencyIndex registration index of the last emergency choice, if any
     * @return index of the chosen lane, or empty if no lane has emergency traffic
     */
    public OptionalInt select(List<LaneDemand> demands, OptionalInt lastEmergencyIndex) {
        Objects.requireNonNull(demands, "demands");
        Objects.requireNonNull(lastEmergencyIndex, "lastEmergencyIndex");

        int max = 0;
        for (LaneDemand d : demands) {
            max = Math.max(max, d.emergency());
        }
        if (max == 0) {
            return OptionalInt.empty();
        }

        final int n = demands.size();
        int start = 0;
        if (lastEmergencyIndex.isPresent() && lastEmergencyIndex.getAsInt() < n) {
            start = (lastEmergencyIndex.getAsInt() + 1) % n;
        }

        for (int i = 0; i < n; i++) {
            int idx = (start + i) % n;
            if (demands.get(idx).emergency() == max) {
                return OptionalInt.of(idx);
            }
        }

        // Unreachable: max was observed in the list.
        throw new IllegalStateException("no lane at emergency maximum " + max);
    }
}
