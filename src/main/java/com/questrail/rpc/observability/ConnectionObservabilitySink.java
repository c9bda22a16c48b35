package com.questrail.rpc.observability;

/**
 * Receives connection lifecycle observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from client lifecycle threads (scheduler and transport
 * threads) and must not block.</p>
 */
public interface ConnectionObservabilitySink {
    /**
     * Called when a client changes lifecycle phase.
     */
    void onStateTransition(ConnectionStateTransitionEvent event);

    /**
     * Called when a heartbeat round succeeds, times out, or fails.
     */
    void onHeartbeat(HeartbeatEvent event);

    /**
     * Called when a dial attempt fails or a client gives up.
     */
    void onError(ConnectionErrorEvent event);
}
