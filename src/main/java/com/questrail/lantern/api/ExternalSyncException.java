package com.questrail.lantern.api;

import java.util.Objects;

/**
 * The push of a new signal value to the external scoring service failed.
 */
public final class ExternalSyncException extends LanternException
{
    public enum Reason {
        /** Host or API key is missing; reported with {@link ErrorKind#INTERNAL}. */
        UNCONFIGURED,
        /** Connection, I/O, or timeout failure while talking to the service. */
        TRANSPORT
    }

    private final Reason reason;

    private ExternalSyncException(Reason reason, String message, Throwable cause) {
        super(reason == Reason.UNCONFIGURED ? ErrorKind.INTERNAL : ErrorKind.EXTERNAL, message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public static ExternalSyncException unconfigured(String message) {
        return new ExternalSyncException(Reason.UNCONFIGURED, message, null);
    }

    public static ExternalSyncException transport(String message, Throwable cause) {
        return new ExternalSyncException(Reason.TRANSPORT, message, cause);
    }

    public Reason reason() {
        return reason;
    }
}
