package com.questrail.rpc.api;

/**
 * Lifecycle phase of a peer client.
 *
 * <pre>
 *   DIALING → TRANSPORT_ESTABLISHED → VERIFYING → READY
 *      ↑                                  │
 *      └──────────── FAILED ←─────────────┘   (dial or first heartbeat failed; backing off)
 *
 *   any phase → CLOSED (terminal)
 * </pre>
 *
 * <p>Health is tracked separately: a {@code READY} client whose last
 * heartbeat timed out is unhealthy but not closed.</p>
 */
public enum ConnectionPhase {
    DIALING,
    TRANSPORT_ESTABLISHED,
    VERIFYING,
    READY,
    FAILED,
    CLOSED
}
