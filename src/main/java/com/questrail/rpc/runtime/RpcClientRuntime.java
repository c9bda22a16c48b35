package com.questrail.rpc.runtime;

import com.questrail.rpc.api.RemoteClockMonitor;
import com.questrail.rpc.client.ClientContext;
import com.questrail.rpc.client.ClientRegistry;
import com.questrail.rpc.clock.LatestOffsetClockMonitor;
import com.questrail.rpc.clock.SystemWallClock;
import com.questrail.rpc.clock.WallClock;
import com.questrail.rpc.config.RpcClientConfig;
import com.questrail.rpc.internal.time.MonotonicClock;
import com.questrail.rpc.internal.time.ScheduledExecutorScheduler;
import com.questrail.rpc.internal.time.SystemMonotonicClock;
import com.questrail.rpc.observability.ConnectionObservabilitySink;
import com.questrail.rpc.observability.Slf4jConnectionObservabilitySink;
import com.questrail.rpc.transport.netty.NettyPeerDialer;

import io.netty.handler.ssl.SslContext;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * RpcClientRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production client stack:
 * scheduler thread, Netty dialer and the {@link ClientRegistry} built on them.
 *
 * <p>{@link #stop()} closes every client, then releases the scheduler thread
 * and the dialer's event loop.</p>
 */
public final class RpcClientRuntime implements AutoCloseable {
    private final ClientRegistry registry;
    private final ScheduledExecutorService schedulerExecutor;
    private final NettyPeerDialer dialer;

    private RpcClientRuntime(
            ClientRegistry registry,
            ScheduledExecutorService schedulerExecutor,
            NettyPeerDialer dialer) {
        this.registry = registry;
        this.schedulerExecutor = schedulerExecutor;
        this.dialer = dialer;
    }

    public ClientRegistry registry() {
        return registry;
    }

    public void stop() {
        registry.closeAll();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        dialer.close();
    }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RpcClientConfig config = RpcClientConfig.defaults();
        private SslContext sslContext;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private RemoteClockMonitor remoteClocks = new LatestOffsetClockMonitor();
        private ConnectionObservabilitySink observabilitySink = new Slf4jConnectionObservabilitySink();

        public Builder withConfig(RpcClientConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Client TLS context; leave unset for plain TCP.
         */
        public Builder withSslContext(SslContext sslContext) {
            this.sslContext = sslContext;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock monotonicClock) {
            this.monotonicClock = monotonicClock;
            return this;
        }

        public Builder withRemoteClocks(RemoteClockMonitor remoteClocks) {
            this.remoteClocks = remoteClocks;
            return this;
        }

        public Builder withObservabilitySink(ConnectionObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public RpcClientRuntime build() {
            Objects.requireNonNull(config, "config");

            ScheduledExecutorService schedulerExec = Executors.newScheduledThreadPool(1);
            NettyPeerDialer dialer = new NettyPeerDialer(config.connectTimeout(), sslContext);

            ClientContext context = ClientContext.builder()
                    .withConfig(config)
                    .withDialer(dialer)
                    .withWallClock(wallClock)
                    .withMonotonicClock(monotonicClock)
                    .withScheduler(new ScheduledExecutorScheduler(schedulerExec, monotonicClock))
                    .withRemoteClocks(remoteClocks)
                    .withObservabilitySink(observabilitySink)
                    .build();

            return new RpcClientRuntime(new ClientRegistry(context), schedulerExec, dialer);
        }
    }
}
