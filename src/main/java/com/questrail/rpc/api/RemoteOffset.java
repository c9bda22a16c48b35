package com.questrail.rpc.api;

/**
 * RemoteOffset
 * =============================================================================
 * A client's estimate of its clock offset from a remote peer.
 *
 * <p>{@code errorNanos} is the maximum error of the reading, so the true offset
 * lies in {@code [offsetNanos - errorNanos, offsetNanos + errorNanos]} as long
 * as network latency is symmetric. If the last heartbeat timed out the offset
 * is {@link #INFINITE}.</p>
 *
 * <p>Offset and error follow the remote clock reading technique of
 * Cristian's algorithm: the peer's reported time is advanced by half the
 * measured round trip.</p>
 *
 * @param offsetNanos     estimated offset of the remote clock from the local clock
 * @param errorNanos      maximum error of the estimate, never negative
 * @param measuredAtNanos local wall time of the measurement, nanoseconds since the epoch
 */
public record RemoteOffset(long offsetNanos, long errorNanos, long measuredAtNanos)
{
    /**
     * Offset used when a heartbeat fails to arrive in time.
     */
    public static final RemoteOffset INFINITE = new RemoteOffset(Long.MAX_VALUE, 0L, 0L);

    /**
     * Offset of a client that has not completed a heartbeat yet.
     */
    public static final RemoteOffset UNMEASURED = new RemoteOffset(0L, 0L, 0L);

    public RemoteOffset {
        if (errorNanos < 0) {
            throw new IllegalArgumentException("errorNanos must be non-negative");
        }
    }

    public boolean isInfinite() {
        return offsetNanos == Long.MAX_VALUE;
    }

    public RemoteOffset withMeasuredAt(long measuredAtNanos) {
        return new RemoteOffset(offsetNanos, errorNanos, measuredAtNanos);
    }
}
