package com.questrail.rpc.transport;

/**
 * A call could not be completed because the underlying connection failed,
 * closed, or could not be opened.
 */
public final class RpcTransportException extends RuntimeException
{
    public RpcTransportException(String message) {
        super(message);
    }

    public RpcTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
