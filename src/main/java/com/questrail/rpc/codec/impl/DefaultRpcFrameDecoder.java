package com.questrail.rpc.codec.impl;

import com.questrail.rpc.api.RemoteOffset;
import com.questrail.rpc.codec.RpcDecodeException;
import com.questrail.rpc.codec.RpcFrame;
import com.questrail.rpc.codec.RpcFrameDecoder;
import com.questrail.rpc.model.PingRequest;
import com.questrail.rpc.model.PingResponse;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * DefaultRpcFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link RpcFrameDecoder}.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Header: version and kind</li>
 *   <li>Kind-specific body</li>
 *   <li>Rejection of trailing bytes</li>
 * </ol>
 */
public final class DefaultRpcFrameDecoder implements RpcFrameDecoder
{
    @Override
    public RpcFrame decode(byte[] body)
    {
        Objects.requireNonNull(body, "body");

        if (body.length < RpcWireFormat.HEADER_LENGTH) {
            throw new RpcDecodeException("frame too short: " + body.length + " bytes");
        }

        ByteBuffer in = ByteBuffer.wrap(body);
        int version = in.get() & 0xFF;
        if (version != RpcWireFormat.VERSION) {
            throw new RpcDecodeException("unsupported frame version " + version);
        }
        int kind = in.get() & 0xFF;
        long callId = in.getLong();

        final RpcFrame frame;
        try {
            switch (kind) {
                case RpcWireFormat.KIND_CALL -> {
                    String method = RpcWireFormat.getString(in);
                    long offset = in.getLong();
                    long error = in.getLong();
                    long measuredAt = in.getLong();
                    String addr = RpcWireFormat.getString(in);
                    if (error < 0) {
                        throw new RpcDecodeException("negative offset error " + error);
                    }
                    frame = new RpcFrame.Call(callId, method,
                            new PingRequest(new RemoteOffset(offset, error, measuredAt), addr));
                }
                case RpcWireFormat.KIND_REPLY ->
                        frame = new RpcFrame.Reply(callId, new PingResponse(in.getLong()));
                case RpcWireFormat.KIND_FAILURE ->
                        frame = new RpcFrame.Failure(callId, RpcWireFormat.getString(in));
                default -> throw new RpcDecodeException(String.format("unknown frame kind 0x%02X", kind));
            }
        } catch (BufferUnderflowException e) {
            throw new RpcDecodeException("truncated frame of kind " + kind, e);
        }

        if (in.hasRemaining()) {
            throw new RpcDecodeException(in.remaining() + " trailing byte(s) after frame");
        }
        return frame;
    }
}
