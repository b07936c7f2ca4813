package com.questrail.intersection.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly outside the decision core
 * (request handling, wire decoding, transport).
 */
public record SignalErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
