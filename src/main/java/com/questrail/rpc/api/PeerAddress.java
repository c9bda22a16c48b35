package com.questrail.rpc.api;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * PeerAddress
 * -----------------------------------------------------------------------------
 * Network address of a peer node, immutable for the life of a client.
 *
 * <p>{@link #key()} ({@code host:port}) is the identity used by the client
 * registry and by the {@link RemoteClockMonitor}.</p>
 */
public record PeerAddress(String host, int port)
{
    public PeerAddress {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be 0-65535");
        }
    }

    /**
     * Parses {@code host:port}. IPv6 hosts must be bracketed ({@code [::1]:26257}).
     */
    public static PeerAddress parse(String address) {
        Objects.requireNonNull(address, "address");

        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("expected host:port but got '" + address + "'");
        }

        String host = address.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }

        final int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in '" + address + "'", e);
        }
        return new PeerAddress(host, port);
    }

    public static PeerAddress of(InetSocketAddress address) {
        Objects.requireNonNull(address, "address");
        return new PeerAddress(address.getHostString(), address.getPort());
    }

    /**
     * Registry and monitor key.
     */
    public String key() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return key();
    }
}
