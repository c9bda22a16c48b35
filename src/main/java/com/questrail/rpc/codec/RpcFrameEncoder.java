package com.questrail.rpc.codec;

/**
 * Byte-level encoder for heartbeat frames.
 *
 * <p>The result is a complete frame body. Length prefixing for the stream
 * transport is applied by the transport adapter, not here.</p>
 */
public interface RpcFrameEncoder
{
    byte[] encode(RpcFrame frame);
}
