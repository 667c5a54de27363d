package ch.netplay.netplaybackend.domain;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An ephemeral multiplayer session keyed by a client-supplied session id.
 *
 * <p>All mutable state (players, peers, subscribers, owner) is guarded by the room's own
 * monitor. Callers that need a check-then-act sequence across several calls synchronize
 * on the room themselves; the methods here are reentrant.
 *
 * <p>Invariants while the room is open:
 * <ul>
 *   <li>{@code players.size() <= maxPlayers} (enforced by the join path)</li>
 *   <li>{@code ownerConnectionId} is the connection of one of the players</li>
 *   <li>the room is closed as soon as it is removed from the registry and never reopened</li>
 * </ul>
 */
@Getter
public class NetplayRoom {

    public static final int DEFAULT_MAX_PLAYERS = 4;

    private final String sessionId;
    private final String roomName;
    private final String gameId;
    private final String domain;
    private final int maxPlayers;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final String password;

    @Getter(AccessLevel.NONE)
    private final Map<String, NetplayPlayer> players = new LinkedHashMap<>();

    @Getter(AccessLevel.NONE)
    private final List<PeerLink> peers = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Set<String> subscribers = new LinkedHashSet<>();

    @Getter(AccessLevel.NONE)
    private String ownerConnectionId;

    @Getter(AccessLevel.NONE)
    private boolean closed;

    public NetplayRoom(String sessionId,
                       NetplayPlayer owner,
                       String roomName,
                       String gameId,
                       String domain,
                       String password,
                       int maxPlayers) {
        this.sessionId = Objects.requireNonNull(sessionId);
        this.roomName = roomName;
        this.gameId = gameId;
        this.domain = domain;
        this.password = (password == null || password.isEmpty()) ? null : password;
        this.maxPlayers = maxPlayers > 0 ? maxPlayers : DEFAULT_MAX_PLAYERS;
        this.createdAt = Instant.now();

        this.players.put(owner.getPlayerId(), owner);
        this.subscribers.add(owner.getConnectionId());
        this.ownerConnectionId = owner.getConnectionId();
    }

    public synchronized String getOwnerConnectionId() {
        return ownerConnectionId;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Marks the room as removed. Joins that already hold a reference see it and fail.
     */
    public synchronized void close() {
        this.closed = true;
    }

    public synchronized int playerCount() {
        return players.size();
    }

    public synchronized boolean isEmpty() {
        return players.isEmpty();
    }

    public synchronized boolean isFull() {
        return players.size() >= maxPlayers;
    }

    public boolean hasPassword() {
        return password != null;
    }

    /**
     * Exact comparison; a protected room never accepts a missing password.
     */
    public boolean passwordMatches(String supplied) {
        return password == null || password.equals(supplied);
    }

    /**
     * Seats a player, replacing any previous entry with the same player id.
     *
     * <p>A replaced entry that was bound to another connection loses its subscription,
     * and ownership follows the player to the new connection. A player seated in an
     * emptied room becomes its owner. Re-seating moves the player to the end of the
     * join order.
     *
     * @return the replaced entry, or {@code null} if the player id was new
     */
    public synchronized NetplayPlayer seat(NetplayPlayer player) {
        NetplayPlayer previous = players.remove(player.getPlayerId());
        players.put(player.getPlayerId(), player);

        if (previous != null && !previous.getConnectionId().equals(player.getConnectionId())) {
            subscribers.remove(previous.getConnectionId());
        }
        subscribers.add(player.getConnectionId());

        // owner was the replaced binding, or the room had been emptied
        if (!isSeated(ownerConnectionId)) {
            ownerConnectionId = player.getConnectionId();
        }

        assertOwnerSeated();
        return previous;
    }

    /**
     * Removes the player only while it is still bound to the given connection.
     *
     * @return {@code true} if an entry was removed
     */
    public synchronized boolean unseat(String playerId, String connectionId) {
        NetplayPlayer current = players.get(playerId);
        if (current == null || !current.getConnectionId().equals(connectionId)) {
            return false;
        }
        players.remove(playerId);
        return true;
    }

    public synchronized void unsubscribe(String connectionId) {
        subscribers.remove(connectionId);
    }

    public synchronized boolean isSubscribed(String connectionId) {
        return subscribers.contains(connectionId);
    }

    /**
     * Drops every signaling pair that has the connection on either side.
     *
     * @return number of pairs removed
     */
    public synchronized int pruneLinks(String connectionId) {
        int before = peers.size();
        peers.removeIf(link -> link.involves(connectionId));
        return before - peers.size();
    }

    /**
     * Records a signaling pair unless the same pair (in either direction) is known.
     */
    public synchronized boolean recordLink(String sourceConnectionId, String targetConnectionId) {
        boolean known = peers.stream().anyMatch(link ->
                link.involves(sourceConnectionId) && link.involves(targetConnectionId));
        if (known) {
            return false;
        }
        peers.add(new PeerLink(sourceConnectionId, targetConnectionId));
        return true;
    }

    /**
     * Hands ownership to the earliest-joined remaining player if the departed
     * connection was the owner.
     *
     * @return the new owner's connection id, or empty if ownership did not change
     */
    public synchronized Optional<String> reassignOwnerIfDeparted(String departedConnectionId) {
        if (!departedConnectionId.equals(ownerConnectionId) || players.isEmpty()) {
            return Optional.empty();
        }
        ownerConnectionId = players.values().iterator().next().getConnectionId();
        assertOwnerSeated();
        return Optional.of(ownerConnectionId);
    }

    public synchronized Optional<NetplayPlayer> findOwner() {
        return players.values().stream()
                .filter(p -> p.getConnectionId().equals(ownerConnectionId))
                .findFirst();
    }

    public synchronized Map<String, NetplayPlayer> playersSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(players));
    }

    public synchronized Set<String> subscribersSnapshot() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(subscribers));
    }

    public synchronized List<PeerLink> peersSnapshot() {
        return List.copyOf(peers);
    }

    private boolean isSeated(String connectionId) {
        return players.values().stream()
                .anyMatch(p -> p.getConnectionId().equals(connectionId));
    }

    private void assertOwnerSeated() {
        if (players.isEmpty()) {
            return;
        }
        if (!isSeated(ownerConnectionId)) {
            throw new IllegalStateException(
                    "Owner " + ownerConnectionId + " is not seated in room " + sessionId);
        }
    }
}
