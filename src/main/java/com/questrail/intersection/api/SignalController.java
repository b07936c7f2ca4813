package com.questrail.intersection.api;

import java.util.List;

/**
 * SignalController
 * -----------------------------------------------------------------------------
 * Semantic façade of the intersection decision loop.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Choosing which lane receives green next, and for how long</li>
 *   <li>Maintaining per-lane aging counters across cycles</li>
 *   <li>Exposing full lane state for diagnostics</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Producing lane counts (detection is a separate pipeline)</li>
 *   <li>Network exposure or request handling</li>
 *   <li>Pacing real signal heads in time</li>
 * </ul>
 *
 * <h2>Reactive model</h2>
 * A controller advances only when {@link #decide(List)} is invoked. There is no
 * timer thread; whether the current green has expired is judged by comparing
 * elapsed clock time at the moment of the call, so idle gaps between calls
 * count as elapsed green time.
 *
 * <h2>Lane set</h2>
 * The set of lane ids in a call is compared with the registered set. Any
 * difference discards all state, including aging and the current green, and
 * re-registers lanes in the order of the new readings.
 *
 * <h2>Threading</h2>
 * Implementations serialize {@code decide} and {@code inspect}; at most one
 * cycle is in flight at a time.
 */
public interface SignalController
{
    /**
     * Runs one decision cycle.
     *
     * @param readings current lane readings; lane ids must be unique
     * @return the per-lane outcome of the cycle; {@link DecisionReport#empty()}
     *         for an empty list
     * @throws IllegalArgumentException if a lane id appears more than once
     */
    DecisionReport decide(List<LaneReading> readings);

    /**
     * Returns a copy of the full controller state.
     */
    ControllerSnapshot inspect();
}
