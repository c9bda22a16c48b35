package com.questrail.rpc.client;

import com.questrail.rpc.api.RemoteOffset;
import com.questrail.rpc.clock.RemoteOffsetEstimator;
import com.questrail.rpc.internal.time.Cancellable;
import com.questrail.rpc.model.PingRequest;
import com.questrail.rpc.model.PingResponse;
import com.questrail.rpc.observability.HeartbeatEvent;
import com.questrail.rpc.transport.PeerTransport;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HeartbeatRound
 * =============================================================================
 * One heartbeat exchange with a peer: a liveness check and a clock-offset
 * measurement in a single call.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>The request carries the client's current offset estimate and its
 *       local address.</li>
 *   <li>The wall clock is read immediately before the call is issued.</li>
 *   <li>The call races a timeout of twice the heartbeat interval. Whichever
 *       happens first decides what is recorded:
 *       <ul>
 *         <li>call first: on success the offset is estimated
 *             ({@link RemoteOffsetEstimator}), the client is marked healthy and
 *             the estimate is published;</li>
 *         <li>timeout first: the client is marked unhealthy, the offset becomes
 *             {@link RemoteOffset#INFINITE} and that is published.</li>
 *       </ul></li>
 *   <li>The round is not abandoned at the timeout. Its result is always the
 *       call's own outcome: it fails with {@link HeartbeatException} if the
 *       call fails, whenever that happens.</li>
 * </ul>
 *
 * <p>A reply that arrives after the timeout does not overwrite the sentinel;
 * the next round measures afresh.</p>
 */
final class HeartbeatRound
{
    private final PeerClient client;
    private final PeerTransport transport;
    private final ClientContext context;

    HeartbeatRound(PeerClient client, PeerTransport transport)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.context = client.context();
    }

    /**
     * Issues the call and returns a future of the round's outcome. Never blocks.
     */
    CompletableFuture<Void> run()
    {
        PingRequest request = new PingRequest(client.remoteOffset(), client.localAddressText());

        long sendTimeNanos = context.wallClock().nowNanos();
        CompletableFuture<PingResponse> call;
        try {
            call = transport.ping(request);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        AtomicBoolean decided = new AtomicBoolean(false);
        Cancellable timeout = context.scheduler().scheduleAfter(
                context.config().heartbeatTimeout(),
                context.monotonicClock(),
                () -> {
                    if (decided.compareAndSet(false, true)) {
                        onTimeout();
                    }
                });

        return call.handle((response, error) -> {
            if (decided.compareAndSet(false, true)) {
                timeout.cancel();
                if (error == null) {
                    onResponse(sendTimeNanos, response);
                }
            }
            if (error != null) {
                Throwable cause = Failures.unwrap(error);
                context.observabilitySink().onHeartbeat(new HeartbeatEvent(
                        context.wallClock().now(), client.address(), HeartbeatEvent.Outcome.FAILED, null, cause));
                throw new HeartbeatException(client.address(), cause);
            }
            return null;
        });
    }

    private void onResponse(long sendTimeNanos, PingResponse response)
    {
        long receiveTimeNanos = context.wallClock().nowNanos();
        RemoteOffset measured = RemoteOffsetEstimator.estimate(
                sendTimeNanos, receiveTimeNanos, response.serverTimeNanos());

        if (client.recordMeasurement(measured)) {
            context.remoteClocks().updateOffset(client.address().key(), measured);
            context.observabilitySink().onHeartbeat(new HeartbeatEvent(
                    context.wallClock().now(), client.address(), HeartbeatEvent.Outcome.SUCCEEDED, measured, null));
        }
    }

    private void onTimeout()
    {
        RemoteOffset sentinel = RemoteOffsetEstimator.timedOut(context.wallClock().nowNanos());

        if (client.recordTimeout(sentinel)) {
            context.remoteClocks().updateOffset(client.address().key(), sentinel);
            context.observabilitySink().onHeartbeat(new HeartbeatEvent(
                    context.wallClock().now(), client.address(), HeartbeatEvent.Outcome.TIMED_OUT, sentinel, null));
        }
    }
}
