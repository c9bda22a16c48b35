package com.questrail.rpc.transport.netty;

import com.questrail.rpc.codec.RpcFrame;
import com.questrail.rpc.codec.RpcFrameDecoder;
import com.questrail.rpc.codec.RpcFrameEncoder;
import com.questrail.rpc.model.PingRequest;
import com.questrail.rpc.model.PingResponse;
import com.questrail.rpc.transport.PeerTransport;
import com.questrail.rpc.transport.RpcCallException;
import com.questrail.rpc.transport.RpcTransportException;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyPeerTransport
 * =============================================================================
 * Client side of one TCP (optionally TLS) connection carrying heartbeat calls.
 *
 * <h2>Call correlation</h2>
 * Each call gets a fresh call id; the reply or failure frame with the same id
 * completes the call's future. When the channel becomes inactive or fails,
 * every outstanding call fails with {@link RpcTransportException}.
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape this package. Inbound frame bodies are copied out
 * of their {@code ByteBuf} before decoding; buffers are released by
 * {@link SimpleChannelInboundHandler}.
 */
final class NettyPeerTransport implements PeerTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyPeerTransport.class);

    private final Channel channel;
    private final RpcFrameEncoder encoder;
    private final RpcFrameDecoder decoder;

    private final AtomicLong nextCallId = new AtomicLong();
    private final ConcurrentMap<Long, CompletableFuture<PingResponse>> pending = new ConcurrentHashMap<>();

    NettyPeerTransport(Channel channel, RpcFrameEncoder encoder, RpcFrameDecoder decoder)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    @Override
    public SocketAddress localAddress()
    {
        return channel.localAddress();
    }

    @Override
    public CompletableFuture<PingResponse> ping(PingRequest request)
    {
        Objects.requireNonNull(request, "request");

        if (!channel.isActive()) {
            return CompletableFuture.failedFuture(
                    new RpcTransportException("connection to " + channel.remoteAddress() + " is closed"));
        }

        long callId = nextCallId.incrementAndGet();
        final byte[] body;
        try {
            body = encoder.encode(new RpcFrame.Call(callId, PingRequest.METHOD, request));
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<PingResponse> call = new CompletableFuture<>();
        pending.put(callId, call);
        channel.writeAndFlush(Unpooled.wrappedBuffer(body)).addListener((ChannelFutureListener) write -> {
            if (!write.isSuccess()) {
                fail(callId, new RpcTransportException("failed to send heartbeat", write.cause()));
            }
        });
        return call;
    }

    @Override
    public void close()
    {
        channel.close();
    }

    int pendingCalls()
    {
        return pending.size();
    }

    ChannelHandler inboundHandler()
    {
        return new InboundHandler();
    }

    private void fail(long callId, Throwable cause)
    {
        CompletableFuture<PingResponse> call = pending.remove(callId);
        if (call != null) {
            call.completeExceptionally(cause);
        }
    }

    private void failAll(Throwable cause)
    {
        List<Long> ids = new ArrayList<>(pending.keySet());
        for (Long id : ids) {
            fail(id, cause);
        }
    }

    /**
     * Receives length-delimited frame bodies and completes outstanding calls.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            byte[] bytes = new byte[msg.readableBytes()];
            msg.getBytes(msg.readerIndex(), bytes);

            RpcFrame frame = decoder.decode(bytes);
            if (frame instanceof RpcFrame.Reply reply) {
                CompletableFuture<PingResponse> call = pending.remove(reply.callId());
                if (call != null) {
                    call.complete(reply.response());
                }
            }
            else if (frame instanceof RpcFrame.Failure failure) {
                fail(failure.callId(), new RpcCallException(failure.message()));
            }
            else {
                log.warn("unexpected call frame from {}; ignoring", ctx.channel().remoteAddress());
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            failAll(new RpcTransportException("connection to " + ctx.channel().remoteAddress() + " closed"));
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.debug("connection to {} failed", ctx.channel().remoteAddress(), cause);
            failAll(new RpcTransportException("connection to " + ctx.channel().remoteAddress() + " failed", cause));
            ctx.close();
        }
    }
}
