package com.questrail.rpc.client;

import com.questrail.rpc.api.RemoteClockMonitor;
import com.questrail.rpc.clock.SystemWallClock;
import com.questrail.rpc.clock.WallClock;
import com.questrail.rpc.config.RpcClientConfig;
import com.questrail.rpc.internal.time.MonotonicClock;
import com.questrail.rpc.internal.time.MonotonicScheduler;
import com.questrail.rpc.internal.time.SystemMonotonicClock;
import com.questrail.rpc.observability.ConnectionObservabilitySink;
import com.questrail.rpc.observability.Slf4jConnectionObservabilitySink;
import com.questrail.rpc.transport.PeerDialer;

import java.util.Objects;

/**
 * ClientContext
 * =============================================================================
 * Everything a {@link ClientRegistry} hands to the clients it creates: timing
 * configuration and the collaborators the lifecycle consumes.
 *
 * <ul>
 *   <li>{@code dialer} opens (optionally TLS-wrapped) transports</li>
 *   <li>{@code wallClock} supplies the local readings used for offset measurement</li>
 *   <li>{@code monotonicClock} and {@code scheduler} drive backoff, cadence and timeouts</li>
 *   <li>{@code remoteClocks} receives every offset measurement</li>
 *   <li>{@code observabilitySink} receives lifecycle events</li>
 * </ul>
 */
public record ClientContext(
        RpcClientConfig config,
        PeerDialer dialer,
        WallClock wallClock,
        MonotonicClock monotonicClock,
        MonotonicScheduler scheduler,
        RemoteClockMonitor remoteClocks,
        ConnectionObservabilitySink observabilitySink
) {
    public ClientContext {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(dialer, "dialer");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(monotonicClock, "monotonicClock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(remoteClocks, "remoteClocks");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RpcClientConfig config = RpcClientConfig.defaults();
        private PeerDialer dialer;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private RemoteClockMonitor remoteClocks;
        private ConnectionObservabilitySink observabilitySink = new Slf4jConnectionObservabilitySink();

        public Builder withConfig(RpcClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder withDialer(PeerDialer dialer) {
            this.dialer = dialer;
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

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
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

        public ClientContext build() {
            return new ClientContext(config, dialer, wallClock, monotonicClock, scheduler,
                    remoteClocks, observabilitySink);
        }
    }
}
