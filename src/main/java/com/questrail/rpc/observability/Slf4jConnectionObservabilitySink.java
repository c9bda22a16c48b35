package com.questrail.rpc.observability;

import com.questrail.rpc.api.ConnectionPhase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ConnectionObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jConnectionObservabilitySink implements ConnectionObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jConnectionObservabilitySink.class);

    @Override
    public void onStateTransition(ConnectionStateTransitionEvent event) {
        if (event.newPhase() == ConnectionPhase.READY) {
            log.info("client {} connected", event.address());
        }
        else if (event.isTerminal()) {
            log.info("client {} closed (was {})", event.address(), event.oldPhase());
        }
        else {
            log.debug("client {}: {} -> {}", event.address(), event.oldPhase(), event.newPhase());
        }
    }

    @Override
    public void onHeartbeat(HeartbeatEvent event) {
        switch (event.outcome()) {
            case SUCCEEDED -> log.debug("client {} heartbeat: offset={}ns error={}ns",
                    event.address(), event.offset().offsetNanos(), event.offset().errorNanos());
            case TIMED_OUT -> log.warn("client {} unhealthy: heartbeat timed out", event.address());
            case FAILED -> log.info("client {} heartbeat failed: {}", event.address(),
                    event.cause() != null ? event.cause().getMessage() : "unknown");
        }
    }

    @Override
    public void onError(ConnectionErrorEvent event) {
        if (event.fatal()) {
            log.error("client {}: {}", event.address(), event.message(), event.cause());
        }
        else {
            log.info("client {}: {}: {}", event.address(), event.message(),
                    event.cause() != null ? event.cause().toString() : "no cause");
        }
    }
}
