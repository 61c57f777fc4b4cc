package com.questrail.lantern.model;

import java.time.Instant;

/**
 * Timed competitive round. Owned externally; the engine only reads it.
 * {@code startTime} and {@code endTime} may be {@code null} when unscheduled.
 */
public record LanternRound(boolean isActive, Instant startTime, Instant endTime)
{
    public static LanternRound inactive() {
        return new LanternRound(false, null, null);
    }
}
