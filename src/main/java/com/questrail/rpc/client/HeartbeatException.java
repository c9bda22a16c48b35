package com.questrail.rpc.client;

import com.questrail.rpc.api.PeerAddress;

/**
 * A heartbeat round ended with a failed call.
 *
 * <p>The cause is the call's own failure: an RPC-level error from the peer or
 * a transport failure. A timeout alone never produces this exception; the
 * round waits for the outstanding call.</p>
 */
public final class HeartbeatException extends RuntimeException
{
    public HeartbeatException(PeerAddress address, Throwable cause) {
        super("heartbeat to " + address + " failed: " + cause.getMessage(), cause);
    }
}
