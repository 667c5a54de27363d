package ch.netplay.netplaybackend.repository;

import ch.netplay.netplaybackend.domain.NetplayRoom;
import ch.netplay.netplaybackend.domain.OpenRoomSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of open netplay rooms, keyed by session id.
 *
 * <p>The map itself is concurrent; each room's fields are guarded by the room's monitor,
 * so operations on different rooms never wait for each other. Nothing is persisted: a
 * restart starts with an empty registry.
 *
 * <p>A room is removed and closed in one step under its monitor, which lets a join that
 * raced with the removal detect it via {@link NetplayRoom#isClosed()}.
 */
@Repository
@Slf4j
public class RoomRegistry {

    private final Map<String, NetplayRoom> rooms = new ConcurrentHashMap<>();

    /**
     * Inserts the room unless its session id is taken.
     *
     * @return {@code false} if a room with that id already exists (nothing is overwritten)
     */
    public boolean create(NetplayRoom room) {
        Objects.requireNonNull(room);
        return rooms.putIfAbsent(room.getSessionId(), room) == null;
    }

    public Optional<NetplayRoom> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rooms.get(sessionId));
    }

    /**
     * Removes and closes the room. Removing an unknown id is a no-op.
     */
    public void remove(String sessionId) {
        NetplayRoom room = rooms.get(sessionId);
        if (room == null) {
            return;
        }
        synchronized (room) {
            if (rooms.remove(sessionId, room)) {
                room.close();
            }
        }
    }

    /**
     * Rooms for the given game that still have a free seat.
     */
    public List<OpenRoomSummary> listOpen(String gameId) {
        return rooms.values().stream()
                .filter(room -> Objects.equals(room.getGameId(), gameId))
                .filter(room -> !room.isClosed() && !room.isFull())
                .map(OpenRoomSummary::from)
                .toList();
    }

    /**
     * Removes every room that has no players left.
     *
     * <p>Emptiness is re-checked under the room's monitor right before removal, so a room
     * that gains a player in the meantime survives.
     *
     * @return number of rooms removed
     */
    public int sweepEmpty() {
        int removed = 0;
        for (NetplayRoom room : rooms.values()) {
            synchronized (room) {
                if (room.isEmpty() && rooms.remove(room.getSessionId(), room)) {
                    room.close();
                    removed++;
                    log.debug("Swept empty room {}", room.getSessionId());
                }
            }
        }
        return removed;
    }

    public int count() {
        return rooms.size();
    }

    public List<NetplayRoom> findAll() {
        return List.copyOf(rooms.values());
    }
}
