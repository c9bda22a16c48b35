package com.questrail.rpc.transport;

/**
 * The peer completed a call with an RPC-level error.
 */
public final class RpcCallException extends RuntimeException
{
    public RpcCallException(String message) {
        super(message);
    }
}
