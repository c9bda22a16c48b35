package com.questrail.rpc.client;

import com.questrail.rpc.api.ConnectionPhase;
import com.questrail.rpc.api.PeerAddress;
import com.questrail.rpc.api.RemoteOffset;
import com.questrail.rpc.internal.time.Cancellable;
import com.questrail.rpc.observability.ConnectionStateTransitionEvent;
import com.questrail.rpc.retry.RetryPolicy;
import com.questrail.rpc.transport.PeerTransport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * PeerClient
 * =============================================================================
 * One logical connection to one peer address.
 *
 * <h2>Lifecycle</h2>
 * A client is created by {@link ClientRegistry#getOrCreate} and immediately
 * starts dialing in the background (see {@link DialRetryLoop}). Once a
 * transport is open and one heartbeat has succeeded the client is ready and a
 * {@link HeartbeatLoop} takes over. The client is closed when a heartbeat
 * fails, when the dial retry budget runs out, or when {@link #close()} is
 * called. A closed client is never reused; the registry creates a new one
 * for the same address on the next request.
 *
 * <h2>Signals</h2>
 * <ul>
 *   <li><b>ready</b>: resolved once, after the first successful heartbeat.</li>
 *   <li><b>closed</b>: resolved once, after the client has left the registry.</li>
 * </ul>
 * Ready is never resolved after closed. Neither future is ever completed
 * exceptionally: a client that gives up resolves closed and leaves ready
 * pending forever. Callbacks attached to the signals run on the lifecycle
 * thread that resolves them and must not block.
 *
 * <h2>Thread Safety</h2>
 * All mutable fields are guarded by {@code lock}, which is never held across
 * network I/O. Only the client's own lifecycle mutates them; accessors may be
 * called from any thread.
 */
public final class PeerClient
{
    private final PeerAddress address;
    private final ClientRegistry registry;
    private final ClientContext context;

    private final Object lock = new Object();
    private TransportState transport = TransportState.NOT_CONNECTED;
    private ConnectionPhase phase = ConnectionPhase.DIALING;
    private ConnectionPhase phaseBeforeClose = ConnectionPhase.DIALING;
    private boolean healthy;
    private boolean closed;
    private RemoteOffset offset = RemoteOffset.UNMEASURED;
    private SocketAddress localAddress;
    private Cancellable pendingStep = Cancellable.NONE;

    // Signals are resolved under their own lock so that resolving "ready" and
    // resolving "closed" are totally ordered.
    private final Object signalLock = new Object();
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private final CompletableFuture<Void> closedSignal = new CompletableFuture<>();

    PeerClient(PeerAddress address, ClientRegistry registry, ClientContext context)
    {
        this.address = Objects.requireNonNull(address, "address");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Launches the background lifecycle. Called once by the registry, outside
     * the registry lock.
     */
    void start(RetryPolicy retryPolicy)
    {
        new DialRetryLoop(this, retryPolicy.start("client " + address + " connection"), context).start();
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public PeerAddress address() {
        return address;
    }

    /**
     * True while a transport is installed.
     */
    public boolean isConnected() {
        synchronized (lock) {
            return transport instanceof TransportState.Connected;
        }
    }

    /**
     * True only while the most recent heartbeat completed within the timeout.
     */
    public boolean isHealthy() {
        synchronized (lock) {
            return healthy;
        }
    }

    /**
     * Local end of the current transport; empty before the first connection.
     */
    public Optional<SocketAddress> localAddress() {
        synchronized (lock) {
            return Optional.ofNullable(localAddress);
        }
    }

    /**
     * Most recently measured offset of the peer's clock from the local clock.
     */
    public RemoteOffset remoteOffset() {
        synchronized (lock) {
            return offset;
        }
    }

    public ConnectionPhase phase() {
        synchronized (lock) {
            return phase;
        }
    }

    public boolean isReady() {
        return ready.isDone();
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * Future resolved after the first successful heartbeat. Completing the
     * returned copy has no effect on the client.
     */
    public CompletableFuture<Void> readyFuture() {
        return ready.copy();
    }

    /**
     * Future resolved when the client has been closed and removed from its
     * registry. Completing the returned copy has no effect on the client.
     */
    public CompletableFuture<Void> closedFuture() {
        return closedSignal.copy();
    }

    /**
     * Waits up to {@code timeout} for the client to become ready.
     *
     * @return {@code true} if the client is ready
     */
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        return await(ready, timeout);
    }

    /**
     * Waits up to {@code timeout} for the client to close.
     *
     * @return {@code true} if the client is closed
     */
    public boolean awaitClosed(Duration timeout) throws InterruptedException {
        return await(closedSignal, timeout);
    }

    /**
     * Closes the client: removes it from the registry, marks it unhealthy,
     * stops its lifecycle, releases the transport and resolves the closed
     * signal. Idempotent and safe to call concurrently; only the first call
     * has any effect. An in-flight dial or heartbeat call is not aborted; its
     * result is discarded.
     */
    public void close()
    {
        if (!registry.remove(this)) {
            return;
        }

        final TransportState released;
        final Cancellable step;
        final ConnectionPhase previous;
        synchronized (lock) {
            released = transport;
            transport = TransportState.RELEASED;
            step = pendingStep;
            pendingStep = Cancellable.NONE;
            previous = phaseBeforeClose;
        }

        step.cancel();
        if (released instanceof TransportState.Connected connected) {
            connected.transport().close();
        }

        synchronized (signalLock) {
            closedSignal.complete(null);
        }
        publishTransition(previous, ConnectionPhase.CLOSED);
    }

    @Override
    public String toString() {
        return "PeerClient[" + address + ", " + phase() + "]";
    }

    // ---------------------------------------------------------------------
    // Lifecycle mutators (background task only)
    // ---------------------------------------------------------------------

    /**
     * Marks the client closed. Called by the registry under its lock.
     *
     * @return {@code false} if the client was already closed
     */
    boolean markClosed()
    {
        synchronized (lock) {
            if (closed) {
                return false;
            }
            closed = true;
            healthy = false;
            phaseBeforeClose = phase;
            phase = ConnectionPhase.CLOSED;
            return true;
        }
    }

    /**
     * Schedules the next lifecycle step, replacing the pending one.
     *
     * @return {@code false} if the client is closed and nothing was scheduled
     */
    boolean schedule(Duration delay, Runnable step)
    {
        synchronized (lock) {
            if (closed) {
                return false;
            }
            pendingStep = context.scheduler().scheduleAfter(delay, context.monotonicClock(), step);
            return true;
        }
    }

    void transition(ConnectionPhase next)
    {
        final ConnectionPhase previous;
        synchronized (lock) {
            if (closed || phase == next) {
                return;
            }
            previous = phase;
            phase = next;
        }
        publishTransition(previous, next);
    }

    /**
     * Installs a freshly opened transport.
     *
     * @return {@code false} if the client closed meanwhile; the caller then
     *         owns the transport and must release it
     */
    boolean installTransport(PeerTransport opened)
    {
        final ConnectionPhase previous;
        synchronized (lock) {
            if (closed) {
                return false;
            }
            transport = new TransportState.Connected(opened);
            localAddress = opened.localAddress();
            previous = phase;
            phase = ConnectionPhase.TRANSPORT_ESTABLISHED;
        }
        publishTransition(previous, ConnectionPhase.TRANSPORT_ESTABLISHED);
        return true;
    }

    /**
     * Drops a transport whose first heartbeat failed. The client stays open
     * and keeps retrying.
     */
    void dropTransport(PeerTransport failed)
    {
        boolean owned = false;
        synchronized (lock) {
            if (transport instanceof TransportState.Connected connected && connected.transport() == failed) {
                transport = TransportState.NOT_CONNECTED;
                healthy = false;
                owned = true;
            }
        }
        // Close released it already otherwise.
        if (owned) {
            failed.close();
        }
    }

    /**
     * Resolves the ready signal.
     *
     * @return {@code true} only for the call that actually resolved it; the
     *         caller then starts the heartbeat loop
     */
    boolean markReady()
    {
        final ConnectionPhase previous;
        synchronized (signalLock) {
            synchronized (lock) {
                if (closed || ready.isDone()) {
                    return false;
                }
                previous = phase;
                phase = ConnectionPhase.READY;
            }
            ready.complete(null);
        }
        publishTransition(previous, ConnectionPhase.READY);
        return true;
    }

    /**
     * Records a successful heartbeat measurement.
     *
     * @return {@code false} if the client is closed and the measurement was discarded
     */
    boolean recordMeasurement(RemoteOffset measured)
    {
        synchronized (lock) {
            if (closed) {
                return false;
            }
            healthy = true;
            offset = measured;
            return true;
        }
    }

    /**
     * Records a heartbeat timeout: unhealthy, offset set to the infinite sentinel.
     *
     * @return {@code false} if the client is closed and nothing was recorded
     */
    boolean recordTimeout(RemoteOffset sentinel)
    {
        synchronized (lock) {
            if (closed) {
                return false;
            }
            healthy = false;
            offset = sentinel;
            return true;
        }
    }

    /**
     * Local address as carried in heartbeat requests; empty when unknown.
     */
    String localAddressText()
    {
        SocketAddress local = localAddress().orElse(null);
        if (local == null) {
            return "";
        }
        if (local instanceof InetSocketAddress inet) {
            return PeerAddress.of(inet).key();
        }
        return local.toString();
    }

    ClientContext context() {
        return context;
    }

    // ---------------------------------------------------------------------

    private void publishTransition(ConnectionPhase from, ConnectionPhase to)
    {
        context.observabilitySink().onStateTransition(new ConnectionStateTransitionEvent(
                context.wallClock().now(), address, from, to));
    }

    private static boolean await(CompletableFuture<Void> signal, Duration timeout) throws InterruptedException
    {
        try {
            signal.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // Signals are only ever completed normally.
            throw new IllegalStateException("signal completed exceptionally", e.getCause());
        }
    }
}
