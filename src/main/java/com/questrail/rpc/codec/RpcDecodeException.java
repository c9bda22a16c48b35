package com.questrail.rpc.codec;

/**
 * Indicates that a frame body could not be decoded.
 *
 * This typically reflects:
 * <ul>
 *   <li>Unknown protocol version or frame kind</li>
 *   <li>Truncated body or trailing garbage</li>
 *   <li>Malformed UTF-8 text fields</li>
 * </ul>
 *
 * A stream transport cannot resynchronise after such a defect, so the
 * connection is closed.
 */
public final class RpcDecodeException extends RuntimeException
{
    public RpcDecodeException(String message) {
        super(message);
    }

    public RpcDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
