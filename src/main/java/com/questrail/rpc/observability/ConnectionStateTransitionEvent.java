package com.questrail.rpc.observability;

import com.questrail.rpc.api.ConnectionPhase;
import com.questrail.rpc.api.PeerAddress;

import java.time.Instant;

/**
 * Record representing a lifecycle phase change of one peer client.
 */
public record ConnectionStateTransitionEvent(
    Instant timestamp,
    PeerAddress address,
    ConnectionPhase oldPhase,
    ConnectionPhase newPhase
) {
    public boolean isTerminal() {
        return newPhase == ConnectionPhase.CLOSED;
    }
}
