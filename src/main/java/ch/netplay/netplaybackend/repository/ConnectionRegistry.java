package ch.netplay.netplaybackend.repository;

import ch.netplay.netplaybackend.domain.PlayerConnection;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of live transport connections, keyed by connection id.
 *
 * <p>A connection is live from the moment it is registered until {@link #remove(String)}
 * is called for its disconnect. Relays only deliver to live connections.
 */
@Repository
public class ConnectionRegistry {

    private final Map<String, PlayerConnection> connections = new ConcurrentHashMap<>();

    /**
     * Returns the tracked connection, registering it on first sight.
     */
    public PlayerConnection register(String connectionId) {
        return connections.computeIfAbsent(connectionId, PlayerConnection::new);
    }

    public Optional<PlayerConnection> findById(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public boolean isConnected(String connectionId) {
        return connectionId != null && connections.containsKey(connectionId);
    }

    /**
     * Forgets the connection. Idempotent: a second call returns empty.
     */
    public Optional<PlayerConnection> remove(String connectionId) {
        return Optional.ofNullable(connections.remove(connectionId));
    }

    public int count() {
        return connections.size();
    }

    public List<PlayerConnection> findAll() {
        Collection<PlayerConnection> values = connections.values();
        return List.copyOf(values);
    }
}
