package com.questrail.rpc.client;

import com.questrail.rpc.api.ConnectionPhase;
import com.questrail.rpc.observability.ConnectionErrorEvent;
import com.questrail.rpc.retry.RetrySequence;
import com.questrail.rpc.transport.PeerTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * DialRetryLoop
 * =============================================================================
 * Connection establishment for a new {@link PeerClient}.
 *
 * <h2>Sequence</h2>
 * <pre>
 *   DIALING ──dial ok──► TRANSPORT_ESTABLISHED ──► VERIFYING ──heartbeat ok──► READY ──► HeartbeatLoop
 *      ▲                                              │
 *      │ backoff                                      │ heartbeat failed: transport dropped
 *      └──────── FAILED ◄──── dial failed ◄───────────┘
 * </pre>
 *
 * <p>A peer that accepts connections but never answers the heartbeat is
 * therefore treated as not yet connected rather than closing the client.
 * Only exhaustion of the retry budget closes the client; the ready signal is
 * then never resolved.</p>
 *
 * <p>Each step is a continuation of the previous one or a task on the
 * scheduler, so the loop never blocks a thread while waiting.</p>
 */
final class DialRetryLoop
{
    private static final Logger log = LoggerFactory.getLogger(DialRetryLoop.class);

    private final PeerClient client;
    private final RetrySequence retry;
    private final ClientContext context;

    DialRetryLoop(PeerClient client, RetrySequence retry, ClientContext context)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.retry = Objects.requireNonNull(retry, "retry");
        this.context = Objects.requireNonNull(context, "context");
    }

    void start()
    {
        client.schedule(Duration.ZERO, this::attempt);
    }

    private void attempt()
    {
        if (client.isClosed()) {
            return;
        }

        retry.recordAttempt();
        client.transition(ConnectionPhase.DIALING);

        CompletableFuture<PeerTransport> dial;
        try {
            dial = context.dialer().dial(client.address());
        } catch (RuntimeException e) {
            dial = CompletableFuture.failedFuture(e);
        }

        dial.handle((transport, error) -> {
            if (error != null) {
                onAttemptFailed("dial failed", Failures.unwrap(error));
            }
            else {
                verify(transport);
            }
            return null;
        }).exceptionally(this::abandon);
    }

    private void verify(PeerTransport transport)
    {
        if (!client.installTransport(transport)) {
            // Closed while dialing.
            transport.close();
            return;
        }
        client.transition(ConnectionPhase.VERIFYING);

        new HeartbeatRound(client, transport).run().handle((ignored, error) -> {
            if (error != null) {
                client.dropTransport(transport);
                onAttemptFailed("first heartbeat failed", Failures.unwrap(error));
            }
            else if (client.markReady()) {
                new HeartbeatLoop(client, transport).start();
            }
            return null;
        }).exceptionally(this::abandon);
    }

    /**
     * A lifecycle step threw before scheduling its successor; the client is closed.
     */
    private Void abandon(Throwable failure)
    {
        log.error("client {} connection loop failed; closing", client.address(), Failures.unwrap(failure));
        client.close();
        return null;
    }

    private void onAttemptFailed(String what, Throwable cause)
    {
        if (client.isClosed()) {
            return;
        }

        if (retry.exhausted()) {
            context.observabilitySink().onError(new ConnectionErrorEvent(
                    context.wallClock().now(), client.address(),
                    "failed to connect", retry.exhaustedError(cause), true));
            client.close();
            return;
        }

        Duration delay = retry.nextDelay();
        context.observabilitySink().onError(new ConnectionErrorEvent(
                context.wallClock().now(), client.address(),
                retry.tag() + ": " + what + "; retrying in " + delay, cause, false));

        client.transition(ConnectionPhase.FAILED);
        client.schedule(delay, this::attempt);
    }
}
