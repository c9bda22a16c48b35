package com.questrail.rpc.observability;

import com.questrail.rpc.api.PeerAddress;

import java.time.Instant;

/**
 * Record representing a failure in a client's lifecycle.
 *
 * @param fatal {@code true} when the failure closes the client (retry budget
 *              exhausted); {@code false} for failures that are retried
 */
public record ConnectionErrorEvent(
    Instant timestamp,
    PeerAddress address,
    String message,
    Throwable cause,
    boolean fatal
) {
}
