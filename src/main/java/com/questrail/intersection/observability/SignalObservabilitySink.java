package com.questrail.intersection.observability;

/**
 * Main interface for receiving intersection observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are invoked outside the controller's lock and must not call
 * back into the controller.</p>
 */
public interface SignalObservabilitySink {
    /**
     * Called after every completed decision cycle.
     */
    void onDecision(DecisionEvent event);

    /**
     * Called when a controller discards its state because the lane set changed.
     */
    void onLaneSetChanged(LaneSetChangedEvent event);

    /**
     * Called when a detection degrades to ordinary traffic.
     */
    void onClassificationFallback(ClassificationFallbackEvent event);

    /**
     * Called when an error or anomaly occurs around the core.
     */
    void onError(SignalErrorEvent event);
}
