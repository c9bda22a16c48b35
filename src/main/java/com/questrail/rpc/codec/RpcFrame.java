package com.questrail.rpc.codec;

import com.questrail.rpc.model.PingRequest;
import com.questrail.rpc.model.PingResponse;

import java.util.Objects;

/**
 * RpcFrame
 * -----------------------------------------------------------------------------
 * One decoded unit of the heartbeat wire protocol.
 *
 * <p>Every frame carries the {@code callId} that correlates a reply (or a
 * failure) with the call that caused it. Frames are the boundary between the
 * byte-level codec and the transport; they carry no connection state.</p>
 */
public sealed interface RpcFrame permits RpcFrame.Call, RpcFrame.Reply, RpcFrame.Failure
{
    /** Upper bound of an encoded frame body, in bytes. */
    int MAX_FRAME_LENGTH = 64 * 1024;

    long callId();

    /** A request for {@code method}. Only {@link PingRequest#METHOD} has a body shape. */
    record Call(long callId, String method, PingRequest request) implements RpcFrame {
        public Call {
            Objects.requireNonNull(method, "method");
            Objects.requireNonNull(request, "request");
        }
    }

    /** Successful answer to a call. */
    record Reply(long callId, PingResponse response) implements RpcFrame {
        public Reply {
            Objects.requireNonNull(response, "response");
        }
    }

    /** RPC-level error answer to a call. */
    record Failure(long callId, String message) implements RpcFrame {
        public Failure {
            Objects.requireNonNull(message, "message");
        }
    }
}
