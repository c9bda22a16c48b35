package com.questrail.rpc.codec;

/**
 * RpcFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for heartbeat frames.
 *
 * <p>The input is exactly one frame body, already delimited by the transport.
 * Accumulation across calls is not supported.</p>
 */
public interface RpcFrameDecoder
{
    /**
     * @param body one complete frame body
     * @return the decoded frame
     * @throws RpcDecodeException if the body is truncated, has trailing bytes,
     *                            an unknown version or kind, or invalid text
     */
    RpcFrame decode(byte[] body);
}
