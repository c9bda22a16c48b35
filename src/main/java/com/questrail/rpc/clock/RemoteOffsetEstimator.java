package com.questrail.rpc.clock;

import com.questrail.rpc.api.RemoteOffset;

/**
 * RemoteOffsetEstimator
 * =============================================================================
 * Computes a {@link RemoteOffset} from one heartbeat exchange.
 *
 * <h2>Algorithm</h2>
 * <pre>
 *   halfRoundTrip = (receiveTime - sendTime) / 2
 *   remoteTimeNow = serverTime + halfRoundTrip
 *   offset        = remoteTimeNow - receiveTime
 *   error         = halfRoundTrip
 *   measuredAt    = receiveTime
 * </pre>
 *
 * <p>The peer is assumed to have read its clock half way through the round
 * trip. Under symmetric latency the true offset lies within
 * {@code offset ± error}. Clock drift during the exchange and the minimum
 * one-way delivery time are not modelled.</p>
 *
 * <p>All inputs are wall-clock nanoseconds since the epoch.</p>
 */
public final class RemoteOffsetEstimator
{
    private RemoteOffsetEstimator() {}

    /**
     * @param sendTimeNanos    local time immediately before the request was issued
     * @param receiveTimeNanos local time the response was observed
     * @param serverTimeNanos  peer clock reading carried in the response
     */
    public static RemoteOffset estimate(long sendTimeNanos, long receiveTimeNanos, long serverTimeNanos)
    {
        // A wall clock stepped backwards mid-exchange would yield a negative
        // round trip; the error bound cannot be negative.
        long halfRoundTrip = Math.max(0L, (receiveTimeNanos - sendTimeNanos) / 2);
        long remoteTimeNow = serverTimeNanos + halfRoundTrip;

        return new RemoteOffset(remoteTimeNow - receiveTimeNanos, halfRoundTrip, receiveTimeNanos);
    }

    /**
     * The estimate recorded when a heartbeat did not complete in time.
     */
    public static RemoteOffset timedOut(long nowNanos)
    {
        return RemoteOffset.INFINITE.withMeasuredAt(nowNanos);
    }
}
