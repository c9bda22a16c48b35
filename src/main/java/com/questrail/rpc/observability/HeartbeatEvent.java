package com.questrail.rpc.observability;

import com.questrail.rpc.api.PeerAddress;
import com.questrail.rpc.api.RemoteOffset;

import java.time.Instant;

/**
 * Record representing the outcome of one heartbeat round.
 *
 * <p>A round that timed out reports {@link Outcome#TIMED_OUT} when the timeout
 * fires and later reports {@link Outcome#FAILED} if the outstanding call then
 * fails.</p>
 *
 * @param offset the offset recorded by the round; {@code null} for {@link Outcome#FAILED}
 * @param cause  failure cause for {@link Outcome#FAILED}, otherwise {@code null}
 */
public record HeartbeatEvent(
    Instant timestamp,
    PeerAddress address,
    Outcome outcome,
    RemoteOffset offset,
    Throwable cause
) {
    public enum Outcome {
        SUCCEEDED,
        TIMED_OUT,
        FAILED
    }
}
