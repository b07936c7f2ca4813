package com.questrail.intersection.core;

/**
 * Source of synthetic vehicle arrivals for lanes that did not receive green.
 */
@FunctionalInterface
public interface ArrivalGenerator
{
    /**
     * Returns the number of new vehicles joining the given lane this cycle.
     * Must be non-negative.
     */
    int arrivals(String laneId);
}
