package com.questrail.rpc.client;

import com.questrail.rpc.api.PeerAddress;
import com.questrail.rpc.retry.RetryPolicy;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ClientRegistry
 * =============================================================================
 * Map from peer address to the single live {@link PeerClient} for it.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>At most one live client per address at any moment; concurrent
 *       requests for the same address share one client.</li>
 *   <li>A client leaves the registry exactly once, when it closes, and only
 *       its own entry is removed (never a replacement for the same address).</li>
 *   <li>A client is returned only while it is still registered. Once its
 *       closed signal is observable it is never returned again.</li>
 * </ul>
 *
 * <h2>Locking</h2>
 * A single lock guards the map and is held only for lookup, insert and
 * delete. Dialing starts after the lock is released.
 *
 * <p>The registry is an ordinary object: construct one per process (see
 * {@code RpcClientRuntime}) and pass it to whatever needs connections.</p>
 */
public final class ClientRegistry
{
    private final ClientContext context;

    private final Object lock = new Object();
    private final Map<String, PeerClient> clients = new HashMap<>();

    public ClientRegistry(ClientContext context)
    {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Returns the client for {@code address}, creating it with the default
     * retry policy if absent.
     */
    public PeerClient getOrCreate(PeerAddress address)
    {
        return getOrCreate(address, null);
    }

    /**
     * Returns the client for {@code address}, creating it if absent.
     *
     * <p>An existing client is returned as is, whatever its phase. A new
     * client is returned immediately and dials in the background; observe
     * {@link PeerClient#readyFuture()} for readiness.</p>
     *
     * @param retryPolicy dial backoff for a newly created client; {@code null}
     *                    selects the configured default. Ignored when the
     *                    client already exists.
     */
    public PeerClient getOrCreate(PeerAddress address, RetryPolicy retryPolicy)
    {
        Objects.requireNonNull(address, "address");

        final PeerClient created;
        synchronized (lock) {
            PeerClient existing = clients.get(address.key());
            if (existing != null) {
                return existing;
            }
            created = new PeerClient(address, this, context);
            clients.put(address.key(), created);
        }

        created.start(retryPolicy != null ? retryPolicy : context.config().retryPolicy());
        return created;
    }

    /**
     * Returns the registered client for {@code address} without creating one.
     */
    public Optional<PeerClient> lookup(PeerAddress address)
    {
        Objects.requireNonNull(address, "address");
        synchronized (lock) {
            return Optional.ofNullable(clients.get(address.key()));
        }
    }

    public int size()
    {
        synchronized (lock) {
            return clients.size();
        }
    }

    /**
     * Snapshot of the registered clients.
     */
    public List<PeerClient> clients()
    {
        synchronized (lock) {
            return List.copyOf(clients.values());
        }
    }

    /**
     * Closes every registered client.
     */
    public void closeAll()
    {
        final List<PeerClient> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(clients.values());
        }
        for (PeerClient client : snapshot) {
            client.close();
        }
    }

    /**
     * Marks {@code client} closed and deletes its entry, if it is still the
     * occupant of its address.
     *
     * @return {@code true} only for the call that performed the removal
     */
    boolean remove(PeerClient client)
    {
        synchronized (lock) {
            if (!client.markClosed()) {
                return false;
            }
            clients.remove(client.address().key(), client);
            return true;
        }
    }
}
