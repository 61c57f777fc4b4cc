package com.questrail.lantern.observability;

/**
 * No-op implementation of LanternObservabilitySink.
 */
public final class NullObservabilitySink implements LanternObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSignalChanged(SignalChangeEvent event) {}

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {}

    @Override
    public void onSyncResult(SyncResultEvent event) {}

    @Override
    public void onError(LanternErrorEvent event) {}
}
