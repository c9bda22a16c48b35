package com.questrail.rpc.transport;

import com.questrail.rpc.model.PingRequest;
import com.questrail.rpc.model.PingResponse;

import java.net.SocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * PeerTransport
 * -----------------------------------------------------------------------------
 * An established connection to one peer, able to carry heartbeat calls.
 *
 * <p>Calls are asynchronous and may be outstanding concurrently. A call that
 * has been issued runs to completion; there is no per-call cancellation.</p>
 */
public interface PeerTransport
{
    /**
     * Local end of the connection.
     */
    SocketAddress localAddress();

    /**
     * Issue a {@code Heartbeat.Ping} call.
     *
     * <p>The future completes with the peer's response, or exceptionally with
     * {@link RpcCallException} (the peer answered with an error) or
     * {@link RpcTransportException} (the connection failed or is closed).</p>
     */
    CompletableFuture<PingResponse> ping(PingRequest request);

    /**
     * Release the connection. Outstanding calls fail with
     * {@link RpcTransportException}. Idempotent.
     */
    void close();
}
