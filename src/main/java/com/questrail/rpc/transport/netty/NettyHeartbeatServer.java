package com.questrail.rpc.transport.netty;

import com.questrail.rpc.codec.RpcFrame;
import com.questrail.rpc.codec.RpcFrameDecoder;
import com.questrail.rpc.codec.RpcFrameEncoder;
import com.questrail.rpc.codec.impl.DefaultRpcFrameDecoder;
import com.questrail.rpc.codec.impl.DefaultRpcFrameEncoder;
import com.questrail.rpc.model.PingRequest;
import com.questrail.rpc.server.HeartbeatService;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.ssl.SslContext;
import io.netty.util.concurrent.GlobalEventExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyHeartbeatServer
 * =============================================================================
 * Accepts heartbeat connections and answers {@code Heartbeat.Ping} calls via
 * {@link HeartbeatService}.
 *
 * <p>Calls for any other method are answered with a failure frame, as are
 * calls whose handling throws. A connection that sends a malformed frame or a
 * reply frame is closed.</p>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} binds synchronously and returns the bound address (useful
 * with port 0). {@link #stop()} closes the listening socket and every accepted
 * connection and shuts down the event loops.
 */
public final class NettyHeartbeatServer implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(NettyHeartbeatServer.class);

    private final InetSocketAddress bindAddress;
    private final HeartbeatService service;
    private final SslContext sslContext;
    private final RpcFrameEncoder encoder = new DefaultRpcFrameEncoder();
    private final RpcFrameDecoder decoder = new DefaultRpcFrameDecoder();

    private final EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final EventLoopGroup workerGroup = new NioEventLoopGroup(1);
    private final ChannelGroup accepted = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile Channel serverChannel;

    /**
     * @param sslContext server TLS context; {@code null} for plain TCP
     */
    public NettyHeartbeatServer(InetSocketAddress bindAddress, HeartbeatService service, SslContext sslContext)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.service = Objects.requireNonNull(service, "service");
        if (sslContext != null && sslContext.isClient()) {
            throw new IllegalArgumentException("sslContext must be a server context");
        }
        this.sslContext = sslContext;
    }

    /**
     * Binds the listening socket.
     *
     * @return the bound address
     */
    public InetSocketAddress start()
    {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        accepted.add(ch);
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast("tls", sslContext.newHandler(ch.alloc()));
                        }
                        p.addLast("frameDecoder", new LengthFieldBasedFrameDecoder(RpcFrame.MAX_FRAME_LENGTH, 0, 4, 0, 4));
                        p.addLast("framePrepender", new LengthFieldPrepender(4));
                        p.addLast("heartbeat", callHandler());
                    }
                });

        Channel channel = bootstrap.bind(bindAddress).syncUninterruptibly().channel();
        serverChannel = channel;

        InetSocketAddress bound = (InetSocketAddress) channel.localAddress();
        log.info("heartbeat server listening on {}", bound);
        return bound;
    }

    /**
     * Idempotent.
     */
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        Channel channel = serverChannel;
        if (channel != null) {
            channel.close().awaitUninterruptibly();
            log.info("heartbeat server on {} stopped", channel.localAddress());
        }
        accepted.close().awaitUninterruptibly();

        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    @Override
    public void close()
    {
        stop();
    }

    ChannelHandler callHandler()
    {
        return new CallHandler();
    }

    /**
     * Dispatches inbound call frames.
     */
    private final class CallHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            byte[] bytes = new byte[msg.readableBytes()];
            msg.getBytes(msg.readerIndex(), bytes);

            RpcFrame frame = decoder.decode(bytes);
            if (!(frame instanceof RpcFrame.Call call)) {
                log.warn("unexpected {} frame from {}; closing", frame.getClass().getSimpleName(), ctx.channel().remoteAddress());
                ctx.close();
                return;
            }

            RpcFrame answer;
            if (!PingRequest.METHOD.equals(call.method())) {
                answer = new RpcFrame.Failure(call.callId(), "unknown method " + call.method());
            }
            else {
                try {
                    answer = new RpcFrame.Reply(call.callId(), service.ping(call.request()));
                } catch (RuntimeException e) {
                    log.warn("heartbeat from {} failed", ctx.channel().remoteAddress(), e);
                    answer = new RpcFrame.Failure(call.callId(), String.valueOf(e.getMessage()));
                }
            }
            ctx.writeAndFlush(Unpooled.wrappedBuffer(encoder.encode(answer)));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("heartbeat connection from {} failed; closing", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}
