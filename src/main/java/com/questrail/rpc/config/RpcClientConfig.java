package com.questrail.rpc.config;

import com.questrail.rpc.retry.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * RpcClientConfig
 * -----------------------------------------------------------------------------
 * Operational timing configuration for peer clients.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>heartbeatInterval</b>: wait between the end of one heartbeat round
 *       and the start of the next. A round that has not completed after twice
 *       this interval marks the client unhealthy (see {@link #heartbeatTimeout()}).</li>
 *   <li><b>retryPolicy</b>: default dial backoff; a caller may override it per
 *       client when the client is first requested.</li>
 *   <li><b>connectTimeout</b>: bound on a single transport-open attempt,
 *       including the TLS handshake.</li>
 * </ul>
 */
public record RpcClientConfig(
        Duration heartbeatInterval,
        RetryPolicy retryPolicy,
        Duration connectTimeout
) {
    public RpcClientConfig {
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
    }

    /**
     * Defaults: 3s heartbeat interval, {@link RetryPolicy#defaults()}, 5s connect timeout.
     */
    public static RpcClientConfig defaults() {
        return builder().build();
    }

    /**
     * Time a heartbeat round may take before the client is marked unhealthy:
     * exactly twice the heartbeat interval.
     */
    public Duration heartbeatTimeout() {
        return heartbeatInterval.multipliedBy(2);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration heartbeatInterval = Duration.ofSeconds(3);
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Duration connectTimeout = Duration.ofSeconds(5);

        public Builder withHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder withRetryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public RpcClientConfig build() {
            return new RpcClientConfig(heartbeatInterval, retryPolicy, connectTimeout);
        }
    }
}
