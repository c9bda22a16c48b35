package com.questrail.rpc.transport;

import com.questrail.rpc.api.PeerAddress;

import java.util.concurrent.CompletableFuture;

/**
 * PeerDialer
 * -----------------------------------------------------------------------------
 * Port for opening a transport to a peer.
 *
 * <p>Implementations may be backed by Netty (optionally TLS-wrapped) or a test
 * harness. A dial never blocks the caller; the outcome is delivered through
 * the returned future.</p>
 *
 * <p>Every failure (unreachable, refused, TLS handshake) is treated by the
 * caller as retryable. A dial that is in flight cannot be cancelled.</p>
 */
public interface PeerDialer
{
    /**
     * @param address peer to connect to
     * @return a future completed with an established transport, or
     *         exceptionally with the dial failure
     */
    CompletableFuture<PeerTransport> dial(PeerAddress address);
}
