package com.questrail.intersection.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements SignalObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onDecision(DecisionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onLaneSetChanged(LaneSetChangedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onClassificationFallback(ClassificationFallbackEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(SignalErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
