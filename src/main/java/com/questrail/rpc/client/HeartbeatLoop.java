package com.questrail.rpc.client;

import com.questrail.rpc.transport.PeerTransport;

import java.util.Objects;

/**
 * HeartbeatLoop
 * =============================================================================
 * Steady-state heartbeating of a ready client.
 *
 * <p>Waits one heartbeat interval, runs a {@link HeartbeatRound}, and repeats
 * until a round fails. A failed round closes the client, which removes it
 * from the registry; the next request for the address creates a fresh client.
 * The loop ends on its own once the client is closed, because a closed client
 * refuses to schedule further steps.</p>
 *
 * <p>After the hand-off from {@link DialRetryLoop} this loop is the only
 * writer of the client's health and offset.</p>
 */
final class HeartbeatLoop
{
    private final PeerClient client;
    private final PeerTransport transport;

    HeartbeatLoop(PeerClient client, PeerTransport transport)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    void start()
    {
        scheduleNext();
    }

    private void scheduleNext()
    {
        client.schedule(client.context().config().heartbeatInterval(), this::beat);
    }

    private void beat()
    {
        if (client.isClosed()) {
            return;
        }

        new HeartbeatRound(client, transport).run().whenComplete((ignored, error) -> {
            if (error != null) {
                // The round already reported the failure; recycle the client.
                client.close();
            }
            else {
                scheduleNext();
            }
        });
    }
}
