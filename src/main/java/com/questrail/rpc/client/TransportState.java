package com.questrail.rpc.client;

import com.questrail.rpc.transport.PeerTransport;

import java.util.Objects;

/**
 * Presence of a client's transport.
 *
 * <p>"Not yet connected" and "released by close" are distinct states; a
 * released client never connects again.</p>
 */
sealed interface TransportState
        permits TransportState.NotConnected, TransportState.Connected, TransportState.Released
{
    NotConnected NOT_CONNECTED = new NotConnected();
    Released RELEASED = new Released();

    /** No transport yet, or the last one was dropped after a failed first heartbeat. */
    record NotConnected() implements TransportState {}

    /** Transport established and installed. */
    record Connected(PeerTransport transport) implements TransportState {
        public Connected {
            Objects.requireNonNull(transport, "transport");
        }
    }

    /** The client is closed and its transport released. Terminal. */
    record Released() implements TransportState {}
}
