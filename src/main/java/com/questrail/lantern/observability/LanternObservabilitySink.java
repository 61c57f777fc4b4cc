package com.questrail.lantern.observability;

/**
 * Main interface for receiving engine observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Implementations must not throw; the engine calls them inline.</p>
 */
public interface LanternObservabilitySink {
    /**
     * Called after a station's new signal value was persisted.
     */
    void onSignalChanged(SignalChangeEvent event);

    /**
     * Called when an owner's session is created, superseded, reused, or terminated.
     */
    void onSessionTransition(SessionTransitionEvent event);

    /**
     * Called when the scoring service answered a push.
     */
    void onSyncResult(SyncResultEvent event);

    /**
     * Called when an operation failed or the decay loop hit an error.
     */
    void onError(LanternErrorEvent event);
}
