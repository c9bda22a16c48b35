package com.questrail.rpc.observability;

/**
 * No-op implementation of ConnectionObservabilitySink.
 */
public final class NullObservabilitySink implements ConnectionObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ConnectionStateTransitionEvent event) {}

    @Override
    public void onHeartbeat(HeartbeatEvent event) {}

    @Override
    public void onError(ConnectionErrorEvent event) {}
}
