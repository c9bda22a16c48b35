package com.questrail.rpc.model;

import com.questrail.rpc.api.RemoteOffset;

import java.util.Objects;

/**
 * Heartbeat request.
 *
 * @param offset the caller's current estimate of its offset from the peer, sent
 *               so that the peer can track the skew in the other direction
 * @param addr   the caller's local transport address as observed on this
 *               connection; empty when unknown
 */
public record PingRequest(RemoteOffset offset, String addr)
{
    /**
     * Service/method identifier of the heartbeat call.
     */
    public static final String METHOD = "Heartbeat.Ping";

    public PingRequest {
        Objects.requireNonNull(offset, "offset");
        Objects.requireNonNull(addr, "addr");
    }
}
