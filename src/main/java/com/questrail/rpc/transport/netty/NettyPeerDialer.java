package com.questrail.rpc.transport.netty;

import com.questrail.rpc.api.PeerAddress;
import com.questrail.rpc.codec.RpcFrame;
import com.questrail.rpc.codec.RpcFrameDecoder;
import com.questrail.rpc.codec.RpcFrameEncoder;
import com.questrail.rpc.codec.impl.DefaultRpcFrameDecoder;
import com.questrail.rpc.codec.impl.DefaultRpcFrameEncoder;
import com.questrail.rpc.transport.PeerDialer;
import com.questrail.rpc.transport.PeerTransport;
import com.questrail.rpc.transport.RpcTransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.AttributeKey;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * NettyPeerDialer
 * =============================================================================
 * Netty-backed implementation of the {@link PeerDialer} port.
 *
 * <h2>Architectural Role</h2>
 * A <strong>pure transport adapter</strong>: it opens TCP connections, wraps
 * them in TLS when an {@link SslContext} is supplied, and installs the
 * heartbeat framing. It does not retry, schedule or interpret heartbeats.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   [tls]  → length-field frame decoder / prepender (4 bytes) → NettyPeerTransport handler
 * </pre>
 *
 * <p>With TLS the dial completes only after the handshake has succeeded, so
 * a handshake failure is a dial failure.</p>
 *
 * <h2>Lifecycle</h2>
 * The dialer owns a dedicated event loop shared by every connection it opens;
 * {@link #close()} shuts it down.
 */
public final class NettyPeerDialer implements PeerDialer, AutoCloseable
{
    private static final AttributeKey<NettyPeerTransport> TRANSPORT = AttributeKey.valueOf("peerTransport");

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final SslContext sslContext;
    private final RpcFrameEncoder encoder = new DefaultRpcFrameEncoder();
    private final RpcFrameDecoder decoder = new DefaultRpcFrameDecoder();

    /**
     * @param connectTimeout bound on one connection attempt
     * @param sslContext     client TLS context; {@code null} for plain TCP
     */
    public NettyPeerDialer(Duration connectTimeout, SslContext sslContext)
    {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (sslContext != null && !sslContext.isClient()) {
            throw new IllegalArgumentException("sslContext must be a client context");
        }
        this.sslContext = sslContext;

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()));
    }

    @Override
    public CompletableFuture<PeerTransport> dial(PeerAddress address)
    {
        Objects.requireNonNull(address, "address");

        CompletableFuture<PeerTransport> result = new CompletableFuture<>();

        ChannelFuture connect = bootstrap.clone()
                .handler(new Initializer(address))
                .connect(address.host(), address.port());

        connect.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                result.completeExceptionally(new RpcTransportException("dial " + address + " failed", future.cause()));
                return;
            }

            Channel channel = future.channel();
            NettyPeerTransport transport = channel.attr(TRANSPORT).get();
            SslHandler tls = channel.pipeline().get(SslHandler.class);
            if (tls == null) {
                result.complete(transport);
                return;
            }

            tls.handshakeFuture().addListener(handshake -> {
                if (handshake.isSuccess()) {
                    result.complete(transport);
                }
                else {
                    channel.close();
                    result.completeExceptionally(
                            new RpcTransportException("TLS handshake with " + address + " failed", handshake.cause()));
                }
            });
        });
        return result;
    }

    @Override
    public void close()
    {
        group.shutdownGracefully();
    }

    private final class Initializer extends ChannelInitializer<SocketChannel>
    {
        private final PeerAddress address;

        private Initializer(PeerAddress address)
        {
            this.address = address;
        }

        @Override
        protected void initChannel(SocketChannel ch)
        {
            ChannelPipeline p = ch.pipeline();
            if (sslContext != null) {
                p.addLast("tls", sslContext.newHandler(ch.alloc(), address.host(), address.port()));
            }
            p.addLast("frameDecoder", new LengthFieldBasedFrameDecoder(RpcFrame.MAX_FRAME_LENGTH, 0, 4, 0, 4));
            p.addLast("framePrepender", new LengthFieldPrepender(4));

            NettyPeerTransport transport = new NettyPeerTransport(ch, encoder, decoder);
            p.addLast("heartbeat", transport.inboundHandler());
            ch.attr(TRANSPORT).set(transport);
        }
    }
}
