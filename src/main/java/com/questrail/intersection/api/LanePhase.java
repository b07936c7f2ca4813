package com.questrail.intersection.api;

/**
 * LanePhase
 * -----------------------------------------------------------------------------
 * Signal state assigned to a single lane.
 *
 * <p>{@link #YELLOW} exists as a label only. The controller applies it to the
 * lane being granted green and overwrites it with {@link #GREEN} within the
 * same decision cycle, so a report never carries it.</p>
 */
public enum LanePhase
{
    RED,
    YELLOW,
    GREEN;

    /**
     * Returns the one-hot {@code [red, yellow, green]} lamp vector for this phase.
     */
    public int[] lamps() {
        return switch (this) {
            case RED -> new int[] {1, 0, 0};
            case YELLOW -> new int[] {0, 1, 0};
            case GREEN -> new int[] {0, 0, 1};
        };
    }
}
