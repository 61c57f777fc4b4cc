package com.questrail.lantern.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for event timestamps and round windows.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It MUST NOT drive the decay cadence.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
