package com.questrail.rpc.client;

import com.questrail.rpc.api.RemoteOffset;
import com.questrail.rpc.observability.HeartbeatEvent;
import com.questrail.rpc.transport.FakePeerTransport;
import com.questrail.rpc.transport.RpcCallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatLoopTest {

    private final ClientFixture f = new ClientFixture();
    private PeerClient client;
    private FakePeerTransport transport;

    @BeforeEach
    void setUp() {
        client = f.dialing();
        transport = f.ready(client);
    }

    @Test
    void heartbeatsRunAtTheConfiguredInterval() {
        f.scheduler.advance(ClientFixture.INTERVAL.minusNanos(1));
        assertEquals(1, transport.calls().size());

        f.scheduler.advance(Duration.ofNanos(1));
        assertEquals(2, transport.calls().size());

        // next interval starts when the round ends
        f.scheduler.advance(ClientFixture.INTERVAL);
        assertEquals(2, transport.calls().size());

        transport.reply(f.wall.nowNanos());
        f.scheduler.advance(ClientFixture.INTERVAL);
        assertEquals(3, transport.calls().size());
    }

    @Test
    void requestCarriesPreviousEstimateAndReplyUpdatesIt() {
        RemoteOffset first = client.remoteOffset();

        f.scheduler.advance(ClientFixture.INTERVAL);
        assertEquals(first, transport.lastCall().request().offset());

        long send = f.wall.nowNanos();
        f.wall.advanceNanos(100);
        transport.reply(send - 500);

        // half round trip 50; offset = -500 + 50 - 100
        RemoteOffset second = client.remoteOffset();
        assertEquals(-550, second.offsetNanos());
        assertEquals(50, second.errorNanos());
        assertEquals(second, f.monitor.last().offset());
        assertTrue(client.isHealthy());
    }

    @Test
    void timeoutMarksUnhealthyWithInfiniteOffsetUntilNextSuccess() {
        f.scheduler.advance(ClientFixture.INTERVAL);
        assertEquals(2, transport.calls().size());

        f.scheduler.advance(ClientFixture.TIMEOUT.minusNanos(1));
        assertTrue(client.isHealthy());

        f.scheduler.advance(Duration.ofNanos(1));
        assertFalse(client.isHealthy());
        assertFalse(client.isClosed(), "a timeout alone does not close the client");
        RemoteOffset sentinel = client.remoteOffset();
        assertTrue(sentinel.isInfinite());
        assertEquals(0, sentinel.errorNanos());
        assertEquals(f.wall.nowNanos(), sentinel.measuredAtNanos());
        assertTrue(f.monitor.last().offset().isInfinite());

        // a reply after the timeout does not replace the sentinel
        transport.reply(f.wall.nowNanos());
        assertTrue(client.remoteOffset().isInfinite());
        assertFalse(client.isHealthy());

        f.scheduler.advance(ClientFixture.INTERVAL);
        assertEquals(3, transport.calls().size());
        assertTrue(transport.lastCall().request().offset().isInfinite());

        transport.reply(f.wall.nowNanos());
        assertTrue(client.isHealthy());
        assertFalse(client.remoteOffset().isInfinite());

        assertEquals(List.of(
                HeartbeatEvent.Outcome.SUCCEEDED,
                HeartbeatEvent.Outcome.TIMED_OUT,
                HeartbeatEvent.Outcome.SUCCEEDED), f.sink.getHeartbeatOutcomes());
    }

    @Test
    void failedHeartbeatClosesClientAndRegistryRecycles() {
        f.scheduler.advance(ClientFixture.INTERVAL);
        transport.failCall(new RpcCallException("shutting down"));

        assertTrue(client.isClosed());
        assertTrue(client.closedFuture().isDone());
        assertFalse(client.isHealthy());
        assertTrue(transport.isClosed());
        assertTrue(f.registry.lookup(ClientFixture.PEER).isEmpty());

        PeerClient replacement = f.registry.getOrCreate(ClientFixture.PEER);
        assertNotSame(client, replacement);
        assertFalse(replacement.isReady());
    }

    @Test
    void errorArrivingAfterTimeoutStillClosesClient() {
        f.scheduler.advance(ClientFixture.INTERVAL);
        f.scheduler.advance(ClientFixture.TIMEOUT);
        assertFalse(client.isClosed());

        transport.close();

        assertTrue(client.isClosed());
        assertEquals(List.of(
                HeartbeatEvent.Outcome.SUCCEEDED,
                HeartbeatEvent.Outcome.TIMED_OUT,
                HeartbeatEvent.Outcome.FAILED), f.sink.getHeartbeatOutcomes());
    }

    @Test
    void closedClientStopsHeartbeating() {
        client.close();

        f.scheduler.advance(ClientFixture.INTERVAL.multipliedBy(5));
        assertEquals(1, transport.calls().size());
        assertEquals(0, f.scheduler.pendingCount());
    }

    @Test
    void errorWithinTimeoutRecordsNoMeasurement() {
        RemoteOffset before = client.remoteOffset();
        int updatesBefore = f.monitor.updates().size();

        f.scheduler.advance(ClientFixture.INTERVAL);
        f.wall.advanceNanos(30);
        transport.failCall(new RpcCallException("method failed"));

        assertEquals(updatesBefore, f.monitor.updates().size(), "nothing published without a server time");
        assertEquals(before, client.remoteOffset());
        assertFalse(client.isHealthy());
        assertTrue(client.isClosed());
        assertEquals(List.of(
                HeartbeatEvent.Outcome.SUCCEEDED,
                HeartbeatEvent.Outcome.FAILED), f.sink.getHeartbeatOutcomes());
    }
}
