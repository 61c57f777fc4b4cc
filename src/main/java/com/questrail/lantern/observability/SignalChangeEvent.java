package com.questrail.lantern.observability;

import java.time.Instant;

/**
 * A station's signal value was persisted.
 */
public record SignalChangeEvent(
    Instant timestamp,
    int stationId,
    int previousValue,
    int newValue,
    Cause cause
) {
    public enum Cause {
        /** Player success through a hack session. */
        ADJUST,
        /** One background step toward the default. */
        DECAY
    }
}
