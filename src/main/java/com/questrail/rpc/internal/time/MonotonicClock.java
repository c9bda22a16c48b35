package com.questrail.rpc.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for connection scheduling.
 *
 * <h2>Binding invariant</h2>
 * Heartbeat cadence, heartbeat timeouts and dial backoff MUST be measured on a
 * monotonic time source. Wall-clock readings are used only for clock-offset
 * measurement (see {@code com.questrail.rpc.clock.WallClock}).
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
