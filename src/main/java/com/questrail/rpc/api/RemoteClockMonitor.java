package com.questrail.rpc.api;

/**
 * Consumer of per-peer clock offset measurements.
 *
 * <p>Clients publish every heartbeat outcome here, including the
 * {@link RemoteOffset#INFINITE} sentinel on timeout. Calls are fire-and-forget
 * and may arrive from any thread.</p>
 */
public interface RemoteClockMonitor
{
    /**
     * @param addressKey {@link PeerAddress#key()} of the peer
     * @param offset     latest estimate for that peer
     */
    void updateOffset(String addressKey, RemoteOffset offset);
}
