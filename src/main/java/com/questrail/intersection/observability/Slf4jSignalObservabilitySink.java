package com.questrail.intersection.observability;

import com.questrail.intersection.api.DecisionReport;
import com.questrail.intersection.api.LaneReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.StringJoiner;

/**
 * Production implementation of SignalObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSignalObservabilitySink implements SignalObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSignalObservabilitySink.class);

    @Override
    public void onDecision(DecisionEvent event) {
        DecisionReport report = event.report();
        if (report.isEmpty()) {
            log.debug("Decision over empty lane set");
            return;
        }

        if (event.laneChanged()) {
            log.info("Green -> {} ({}, {}s)",
                report.chosenLane().orElse("-"),
                report.reason().map(Enum::name).orElse("-"),
                String.format("%.1f", report.greenTime()));
        }
        else {
            log.debug("Green held on {} ({}, {}s)",
                report.chosenLane().orElse("-"),
                report.reason().map(Enum::name).orElse("-"),
                String.format("%.1f", report.greenTime()));
        }

        if (log.isDebugEnabled()) {
            StringJoiner waits = new StringJoiner(", ", "[", "]");
            for (Map.Entry<String, LaneReport> e : report.lanes().entrySet()) {
                waits.add(e.getKey() + "=" + e.getValue().waitCycles());
            }
            log.debug("Wait counters: {}", waits);
        }
    }

    @Override
    public void onLaneSetChanged(LaneSetChangedEvent event) {
        log.info("Lane set changed: {} -> {}; all lane state reset",
            event.previousLanes(), event.newLanes());
    }

    @Override
    public void onClassificationFallback(ClassificationFallbackEvent event) {
        log.debug("Detection on lane {} counted as normal: {}", event.laneId(), event.reason());
    }

    @Override
    public void onError(SignalErrorEvent event) {
        log.error("Intersection error: {}", event.message(), event.cause());
    }
}
