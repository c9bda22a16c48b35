package com.questrail.rpc.server;

import com.questrail.rpc.api.RemoteOffset;
import com.questrail.rpc.clock.RecordingClockMonitor;
import com.questrail.rpc.model.PingRequest;
import com.questrail.rpc.model.PingResponse;
import com.questrail.rpc.time.ManualWallClock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatServiceTest {

    private final ManualWallClock clock = new ManualWallClock(5_000);
    private final RecordingClockMonitor monitor = new RecordingClockMonitor();
    private final HeartbeatService service = new HeartbeatService(clock, monitor);

    @Test
    void answersWithLocalWallTime() {
        PingResponse response = service.ping(new PingRequest(RemoteOffset.UNMEASURED, ""));

        assertEquals(5_000, response.serverTimeNanos());
        assertTrue(monitor.updates().isEmpty(), "requests without an address are not recorded");
    }

    @Test
    void recordsNegatedOffsetUnderCallerAddress() {
        service.ping(new PingRequest(new RemoteOffset(880, 20, 140), "10.0.0.2:51000"));

        RecordingClockMonitor.Update update = monitor.last();
        assertEquals("10.0.0.2:51000", update.addressKey());
        assertEquals(new RemoteOffset(-880, 20, 140), update.offset());
    }

    @Test
    void infiniteOffsetIsRecordedUnchanged() {
        RemoteOffset sentinel = RemoteOffset.INFINITE.withMeasuredAt(77);

        service.ping(new PingRequest(sentinel, "10.0.0.2:51000"));

        assertEquals(sentinel, monitor.last().offset());
    }
}
