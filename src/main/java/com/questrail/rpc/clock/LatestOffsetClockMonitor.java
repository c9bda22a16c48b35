package com.questrail.rpc.clock;

import com.questrail.rpc.api.RemoteClockMonitor;
import com.questrail.rpc.api.RemoteOffset;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RemoteClockMonitor} that retains the most recent offset reported for
 * each peer.
 *
 * <p>Aggregation into a cluster-wide offset bound is left to consumers of
 * {@link #snapshot()}.</p>
 */
public final class LatestOffsetClockMonitor implements RemoteClockMonitor
{
    private final Map<String, RemoteOffset> offsets = new ConcurrentHashMap<>();

    @Override
    public void updateOffset(String addressKey, RemoteOffset offset)
    {
        Objects.requireNonNull(addressKey, "addressKey");
        Objects.requireNonNull(offset, "offset");
        offsets.put(addressKey, offset);
    }

    public Optional<RemoteOffset> offset(String addressKey)
    {
        return Optional.ofNullable(offsets.get(addressKey));
    }

    /**
     * Immutable copy of the latest offset per peer key.
     */
    public Map<String, RemoteOffset> snapshot()
    {
        return Map.copyOf(offsets);
    }
}
