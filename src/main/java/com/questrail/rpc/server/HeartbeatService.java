package com.questrail.rpc.server;

import com.questrail.rpc.api.RemoteClockMonitor;
import com.questrail.rpc.api.RemoteOffset;
import com.questrail.rpc.clock.WallClock;
import com.questrail.rpc.model.PingRequest;
import com.questrail.rpc.model.PingResponse;

import java.util.Objects;

/**
 * HeartbeatService
 * =============================================================================
 * Peer side of the heartbeat: answers {@code Heartbeat.Ping} with the local
 * wall clock reading.
 *
 * <p>The caller's request carries its estimate of <em>our</em> offset from
 * <em>its</em> clock. Negated, that is our estimate of the caller's offset
 * from us, so it is recorded in our own {@link RemoteClockMonitor} under the
 * address the caller reported. Requests without an address are answered but
 * not recorded, and the infinite sentinel is recorded unchanged.</p>
 *
 * <p>Transport independent; {@code NettyHeartbeatServer} dispatches to it.</p>
 */
public final class HeartbeatService
{
    private final WallClock clock;
    private final RemoteClockMonitor remoteClocks;

    public HeartbeatService(WallClock clock, RemoteClockMonitor remoteClocks)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.remoteClocks = Objects.requireNonNull(remoteClocks, "remoteClocks");
    }

    public PingResponse ping(PingRequest request)
    {
        Objects.requireNonNull(request, "request");

        if (!request.addr().isEmpty()) {
            remoteClocks.updateOffset(request.addr(), reciprocal(request.offset()));
        }
        return new PingResponse(clock.nowNanos());
    }

    static RemoteOffset reciprocal(RemoteOffset offset)
    {
        if (offset.isInfinite()) {
            return offset;
        }
        return new RemoteOffset(-offset.offsetNanos(), offset.errorNanos(), offset.measuredAtNanos());
    }
}
