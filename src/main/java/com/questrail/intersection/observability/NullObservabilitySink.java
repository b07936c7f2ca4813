package com.questrail.intersection.observability;

/**
 * No-op implementation of SignalObservabilitySink.
 */
public final class NullObservabilitySink implements SignalObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onDecision(DecisionEvent event) {}

    @Override
    public void onLaneSetChanged(LaneSetChangedEvent event) {}

    @Override
    public void onClassificationFallback(ClassificationFallbackEvent event) {}

    @Override
    public void onError(SignalErrorEvent event) {}
}
