package com.questrail.lantern.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the engine.
 */
public record LanternErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
