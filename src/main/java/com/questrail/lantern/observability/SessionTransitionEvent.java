package com.questrail.lantern.observability;

import com.questrail.lantern.hack.SessionSlot;

import java.time.Instant;

/**
 * An owner's session slot changed, or was explicitly kept (reuse).
 */
public record SessionTransitionEvent(
    Instant timestamp,
    String owner,
    SessionSlot from,
    SessionSlot to,
    Reason reason
) {
    public enum Reason {
        CREATED,
        SUPERSEDED,
        REUSED,
        SUCCEEDED,
        EXHAUSTED
    }
}
