package com.questrail.intersection.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used for timestamps in reports and observability events.
 *
 * <p>This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It MUST NOT be used to decide green expiry.</p>
 */
public interface WallClock
{
    Instant now();
}
