package com.questrail.lantern.observability;

import com.questrail.lantern.sync.SignalReport;

import java.time.Instant;

/**
 * The scoring service answered a push.
 */
public record SyncResultEvent(
    Instant timestamp,
    SignalReport report,
    int statusCode
) {
}
