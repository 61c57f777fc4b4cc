package com.questrail.lantern.api;

import java.util.Objects;

/**
 * Base type for all failures surfaced by the hacking engine.
 *
 * <p>Every subclass maps to exactly one {@link ErrorKind}, except
 * {@link ExternalSyncException}, which reports {@link ErrorKind#INTERNAL}
 * when the sync client is unconfigured.</p>
 */
public abstract class LanternException extends RuntimeException
{
    private final ErrorKind kind;

    protected LanternException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected LanternException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
