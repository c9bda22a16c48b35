package com.questrail.rpc.client;

import com.questrail.rpc.api.ConnectionPhase;
import com.questrail.rpc.api.RemoteOffset;
import com.questrail.rpc.clock.LatestOffsetClockMonitor;
import com.questrail.rpc.observability.ConnectionErrorEvent;
import com.questrail.rpc.observability.ConnectionObservabilitySink;
import com.questrail.rpc.observability.ConnectionStateTransitionEvent;
import com.questrail.rpc.observability.HeartbeatEvent;
import com.questrail.rpc.time.DeterministicScheduler;
import com.questrail.rpc.time.ManualMonotonicClock;
import com.questrail.rpc.transport.FakePeerDialer;
import com.questrail.rpc.retry.RetryExhaustedException;
import com.questrail.rpc.retry.RetryPolicy;
import com.questrail.rpc.transport.FakePeerTransport;
import com.questrail.rpc.transport.RpcCallException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeerClientLifecycleTest {

    private final ClientFixture f = new ClientFixture();

    @Test
    void becomesReadyAfterDialAndFirstHeartbeat() {
        PeerClient client = f.registry.getOrCreate(ClientFixture.PEER);
        assertEquals(0, f.dialer.dialCount(), "dialing starts on the scheduler");
        assertEquals(ConnectionPhase.DIALING, client.phase());

        f.scheduler.runDueTasks();
        assertEquals(1, f.dialer.dialCount());
        assertEquals(ClientFixture.PEER, f.dialer.lastDial().address());

        FakePeerTransport transport = f.dialer.lastDial().succeed();
        assertTrue(client.isConnected());
        assertFalse(client.isReady(), "not ready before the first heartbeat");
        assertEquals(ConnectionPhase.VERIFYING, client.phase());

        FakePeerTransport.Call first = transport.lastCall();
        assertEquals(RemoteOffset.UNMEASURED, first.request().offset());
        assertEquals("127.0.0.1:40000", first.request().addr());

        f.wall.advanceNanos(40);
        transport.reply(ClientFixture.WALL_START + 1000);

        assertTrue(client.isReady());
        assertTrue(client.readyFuture().isDone());
        assertTrue(client.isHealthy());
        assertEquals(ConnectionPhase.READY, client.phase());

        // half round trip 20; offset = 1000 + 20 - 40
        RemoteOffset offset = client.remoteOffset();
        assertEquals(980, offset.offsetNanos());
        assertEquals(20, offset.errorNanos());
        assertEquals(ClientFixture.WALL_START + 40, offset.measuredAtNanos());

        assertEquals(ClientFixture.PEER.key(), f.monitor.last().addressKey());
        assertEquals(offset, f.monitor.last().offset());

        assertEquals(List.of(
                ConnectionPhase.TRANSPORT_ESTABLISHED,
                ConnectionPhase.VERIFYING,
                ConnectionPhase.READY), f.sink.getPhases());
    }

    @Test
    void dialFailuresBackOffExponentiallyUpToTheCap() {
        PeerClient client = f.dialing();

        f.dialer.lastDial().fail("connection refused");
        assertEquals(ConnectionPhase.FAILED, client.phase());

        f.scheduler.advance(Duration.ofMillis(999));
        assertEquals(1, f.dialer.dialCount());
        f.scheduler.advance(Duration.ofMillis(1));
        assertEquals(2, f.dialer.dialCount());
        assertEquals(ConnectionPhase.DIALING, client.phase());

        f.dialer.lastDial().fail("connection refused");
        f.scheduler.advance(Duration.ofMillis(1999));
        assertEquals(2, f.dialer.dialCount());
        f.scheduler.advance(Duration.ofMillis(1));
        assertEquals(3, f.dialer.dialCount());

        f.dialer.lastDial().fail("connection refused");
        f.scheduler.advance(Duration.ofSeconds(4));
        assertEquals(4, f.dialer.dialCount());

        // capped at 4s from here on
        f.dialer.lastDial().fail("connection refused");
        f.scheduler.advance(Duration.ofMillis(3999));
        assertEquals(4, f.dialer.dialCount());
        f.scheduler.advance(Duration.ofMillis(1));
        assertEquals(5, f.dialer.dialCount());

        List<ConnectionErrorEvent> errors = f.sink.getErrors();
        assertEquals(4, errors.size());
        assertTrue(errors.stream().noneMatch(ConnectionErrorEvent::fatal));
        assertTrue(errors.get(0).message().startsWith("client 10.0.0.1:26257 connection"));

        assertFalse(client.isClosed());
        assertFalse(client.isReady());
        assertSame(client, f.registry.getOrCreate(ClientFixture.PEER));
    }

    @Test
    void failedFirstHeartbeatDropsTransportAndRetries() {
        PeerClient client = f.dialing();

        FakePeerTransport first = f.dialer.lastDial().succeed();
        first.failCall(new RpcCallException("no such service"));

        assertTrue(first.isClosed());
        assertFalse(client.isConnected());
        assertFalse(client.isClosed());
        assertFalse(client.isReady());
        assertEquals(ConnectionPhase.FAILED, client.phase());

        f.scheduler.advance(Duration.ofSeconds(1));
        assertEquals(2, f.dialer.dialCount());

        f.ready(client);
        assertTrue(client.isReady());
        assertTrue(client.isConnected());
    }

    @Test
    void unansweredFirstHeartbeatKeepsRetryingAfterTransportCloses() {
        PeerClient client = f.dialing();

        FakePeerTransport first = f.dialer.lastDial().succeed();
        f.scheduler.advance(ClientFixture.TIMEOUT);
        assertFalse(client.isHealthy());
        assertTrue(client.remoteOffset().isInfinite());

        // the round only ends when the call does
        assertEquals(1, f.dialer.dialCount());
        first.close();

        f.scheduler.advance(Duration.ofSeconds(1));
        assertEquals(2, f.dialer.dialCount());
        assertFalse(client.isClosed());
    }

    @Test
    void exhaustedRetryBudgetClosesWithoutReady() {
        PeerClient client = f.registry.getOrCreate(ClientFixture.PEER,
                new RetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 1.0, 2));
        f.scheduler.runDueTasks();

        f.dialer.lastDial().fail("connection refused");
        assertFalse(client.isClosed());

        f.scheduler.advance(Duration.ofSeconds(1));
        f.dialer.lastDial().fail("connection refused");

        assertTrue(client.isClosed());
        assertTrue(client.closedFuture().isDone());
        assertFalse(client.isReady());
        assertFalse(client.readyFuture().isDone());
        assertTrue(f.registry.lookup(ClientFixture.PEER).isEmpty());

        ConnectionErrorEvent fatal = f.sink.getErrors().get(f.sink.getErrors().size() - 1);
        assertTrue(fatal.fatal());
        RetryExhaustedException exhausted = assertInstanceOf(RetryExhaustedException.class, fatal.cause());
        assertEquals(2, exhausted.attempts());

        f.scheduler.advance(Duration.ofSeconds(10));
        assertEquals(2, f.dialer.dialCount(), "no attempts after closing");

        PeerClient replacement = f.registry.getOrCreate(ClientFixture.PEER);
        assertNotSame(client, replacement);
    }

    @Test
    void closeDuringDialReleasesLateTransportAndNeverBecomesReady() {
        PeerClient client = f.dialing();

        client.close();
        assertTrue(client.isClosed());
        assertTrue(client.closedFuture().isDone());

        FakePeerTransport late = f.dialer.lastDial().succeed();
        assertTrue(late.isClosed());
        assertTrue(late.calls().isEmpty());
        assertFalse(client.isReady());
        assertFalse(client.isConnected());
        assertEquals(ConnectionPhase.CLOSED, client.phase());
    }

    @Test
    void closeDuringBackoffCancelsNextAttempt() {
        PeerClient client = f.dialing();
        f.dialer.lastDial().fail("connection refused");

        client.close();
        f.scheduler.advance(Duration.ofSeconds(30));

        assertEquals(1, f.dialer.dialCount());
        assertEquals(0, f.scheduler.pendingCount());
    }

    @Test
    void closeIsIdempotentAndReleasesTransport() {
        PeerClient client = f.dialing();
        FakePeerTransport transport = f.ready(client);

        client.close();
        client.close();

        assertTrue(transport.isClosed());
        assertFalse(client.isHealthy());
        assertFalse(client.isConnected());
        assertEquals(1, f.sink.getPhases().stream().filter(p -> p == ConnectionPhase.CLOSED).count());

        f.scheduler.advance(ClientFixture.INTERVAL.multipliedBy(3));
        assertEquals(1, transport.calls().size(), "no heartbeats after close");
    }

    @Test
    void awaitReadyAndAwaitClosedReportSignals() throws InterruptedException {
        PeerClient client = f.dialing();
        assertFalse(client.awaitReady(Duration.ofMillis(10)));

        f.ready(client);
        assertTrue(client.awaitReady(Duration.ofMillis(10)));
        assertFalse(client.awaitClosed(Duration.ofMillis(10)));

        client.close();
        assertTrue(client.awaitClosed(Duration.ofMillis(10)));
    }

    @Test
    void completingReturnedSignalCopiesDoesNotAffectClient() {
        PeerClient client = f.dialing();

        client.readyFuture().complete(null);
        client.closedFuture().complete(null);

        assertFalse(client.isReady());
        assertFalse(client.isClosed());
    }

    @Test
    void failingErrorReportClosesClientInsteadOfStalling() {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        FakePeerDialer dialer = new FakePeerDialer();
        ClientRegistry registry = new ClientRegistry(ClientContext.builder()
                .withDialer(dialer)
                .withMonotonicClock(clock)
                .withScheduler(scheduler)
                .withRemoteClocks(new LatestOffsetClockMonitor())
                .withObservabilitySink(new ConnectionObservabilitySink() {
                    @Override
                    public void onStateTransition(ConnectionStateTransitionEvent event) {}

                    @Override
                    public void onHeartbeat(HeartbeatEvent event) {}

                    @Override
                    public void onError(ConnectionErrorEvent event) {
                        throw new IllegalStateException("sink unavailable");
                    }
                })
                .build());

        PeerClient client = registry.getOrCreate(ClientFixture.PEER);
        scheduler.runDueTasks();
        dialer.lastDial().fail("connection refused");

        assertTrue(client.isClosed());
        assertTrue(client.closedFuture().isDone());
        assertTrue(registry.lookup(ClientFixture.PEER).isEmpty());
        assertEquals(0, scheduler.pendingCount());
    }
}
