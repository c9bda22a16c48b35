package com.questrail.rpc.codec.impl;

import com.questrail.rpc.api.RemoteOffset;
import com.questrail.rpc.codec.RpcFrame;
import com.questrail.rpc.codec.RpcFrameEncoder;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * DefaultRpcFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link RpcFrameEncoder}.
 *
 * <p>The mechanical inverse of {@link DefaultRpcFrameDecoder}.</p>
 */
public final class DefaultRpcFrameEncoder implements RpcFrameEncoder
{
    @Override
    public byte[] encode(RpcFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        final ByteBuffer out;
        if (frame instanceof RpcFrame.Call call) {
            byte[] method = RpcWireFormat.utf8(call.method());
            byte[] addr = RpcWireFormat.utf8(call.request().addr());
            RemoteOffset offset = call.request().offset();

            out = header(RpcWireFormat.KIND_CALL, call.callId(),
                    2 + method.length + 3 * Long.BYTES + 2 + addr.length);
            RpcWireFormat.putString(out, method);
            out.putLong(offset.offsetNanos());
            out.putLong(offset.errorNanos());
            out.putLong(offset.measuredAtNanos());
            RpcWireFormat.putString(out, addr);
        }
        else if (frame instanceof RpcFrame.Reply reply) {
            out = header(RpcWireFormat.KIND_REPLY, reply.callId(), Long.BYTES);
            out.putLong(reply.response().serverTimeNanos());
        }
        else {
            RpcFrame.Failure failure = (RpcFrame.Failure) frame;
            byte[] message = RpcWireFormat.utf8(failure.message());

            out = header(RpcWireFormat.KIND_FAILURE, failure.callId(), 2 + message.length);
            RpcWireFormat.putString(out, message);
        }

        if (out.capacity() > RpcWireFormat.MAX_FRAME_LENGTH) {
            throw new IllegalArgumentException("frame exceeds " + RpcWireFormat.MAX_FRAME_LENGTH + " bytes");
        }
        return out.array();
    }

    private static ByteBuffer header(int kind, long callId, int bodyLength)
    {
        ByteBuffer out = ByteBuffer.allocate(RpcWireFormat.HEADER_LENGTH + bodyLength);
        out.put((byte) RpcWireFormat.VERSION);
        out.put((byte) kind);
        out.putLong(callId);
        return out;
    }
}
