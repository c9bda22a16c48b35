package com.questrail.rpc.model;

/**
 * Heartbeat response.
 *
 * @param serverTimeNanos the peer's wall clock reading, nanoseconds since the epoch
 */
public record PingResponse(long serverTimeNanos)
{
}
