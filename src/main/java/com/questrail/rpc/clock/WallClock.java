package com.questrail.rpc.clock;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Physical clock used for clock-offset measurement.
 *
 * <p>In a database node this is the physical component of the hybrid logical
 * clock. Readings may jump (NTP, manual changes); that is exactly what the
 * heartbeat measures. Cadence, timeouts and backoff MUST NOT be derived from
 * it; they use {@code MonotonicClock}.</p>
 */
public interface WallClock
{
    /**
     * Current wall time in nanoseconds since the Unix epoch.
     */
    long nowNanos();

    /**
     * Current wall time as an {@link Instant}, for observability.
     */
    default Instant now() {
        return Instant.ofEpochSecond(0L, nowNanos());
    }
}
