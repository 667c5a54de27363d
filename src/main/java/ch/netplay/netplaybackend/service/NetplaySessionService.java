package ch.netplay.netplaybackend.service;

import ch.netplay.netplaybackend.domain.NetplayPlayer;
import ch.netplay.netplaybackend.domain.NetplayRoom;
import ch.netplay.netplaybackend.domain.PlayerConnection;
import ch.netplay.netplaybackend.domain.PlayerConnection.Attachment;
import ch.netplay.netplaybackend.domain.enums.NetplayErrorCode;
import ch.netplay.netplaybackend.domain.enums.NetplayEventType;
import ch.netplay.netplaybackend.domain.exception.NetplayException;
import ch.netplay.netplaybackend.repository.ConnectionRegistry;
import ch.netplay.netplaybackend.repository.RoomRegistry;
import ch.netplay.netplaybackend.web.api.dto.PlayerDto;
import ch.netplay.netplaybackend.web.api.dto.SignalDto;
import ch.netplay.netplaybackend.web.api.dto.SignalRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Coordinates netplay rooms: opening, joining, leaving, and relaying peer traffic.
 *
 * <p>Every inbound event is scoped to the connection it arrived on. Room state lives in
 * the {@link RoomRegistry}; each room is mutated only while holding its monitor, so
 * traffic in one room never waits on another. Outbound events are fire-and-forget via
 * {@link NetplayMessenger}.
 *
 * <p>Membership changes broadcast the full player map ({@code users-updated}) to the
 * room's subscribers. A stale update is always followed by a fresher one, so clients
 * converge without ordering guarantees across connections.
 *
 * <p>Policy rejections are raised as {@link NetplayException}; relay failures are
 * silent drops.
 */
@Service
@Slf4j
public class NetplaySessionService {

    static final String DEFAULT_GAME_ID = "default";
    static final String DEFAULT_DOMAIN = "unknown";

    private static final Set<NetplayEventType> ROOM_RELAY_TYPES =
            EnumSet.of(NetplayEventType.DATA_MESSAGE, NetplayEventType.SNAPSHOT, NetplayEventType.INPUT);

    private final RoomRegistry roomRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final NetplayMessenger messenger;
    private final int defaultMaxPlayers;

    public NetplaySessionService(RoomRegistry roomRegistry,
                                 ConnectionRegistry connectionRegistry,
                                 NetplayMessenger messenger,
                                 @Value("${netplay.rooms.default-max-players:4}") int defaultMaxPlayers) {
        this.roomRegistry = roomRegistry;
        this.connectionRegistry = connectionRegistry;
        this.messenger = messenger;
        this.defaultMaxPlayers = defaultMaxPlayers;
    }

    /**
     * Registers a newly established transport connection.
     */
    public void handleConnect(String connectionId) {
        connectionRegistry.register(connectionId);
        log.debug("Connection {} established", connectionId);
    }

    /**
     * Opens a new room with the requesting connection as owner and only player.
     *
     * @param connectionId requesting connection
     * @param extra        room and player metadata ({@code sessionid}, {@code userid}, ...)
     * @param password     optional password, empty means open room
     * @param maxPlayers   optional capacity, missing or non-positive means the default
     * @return the players of the new room
     * @throws NetplayException {@code INVALID_REQUEST}, {@code ROOM_ALREADY_EXISTS} or
     *                          {@code CONNECTION_CLOSED}
     */
    public Map<String, NetplayPlayer> openRoom(String connectionId,
                                               Map<String, Object> extra,
                                               String password,
                                               Integer maxPlayers) {
        String sessionId = text(extra, "sessionid");
        String playerId = playerIdOf(extra);
        if (isBlank(sessionId) || isBlank(playerId)) {
            throw new NetplayException(NetplayErrorCode.INVALID_REQUEST);
        }
        if (roomRegistry.get(sessionId).isPresent()) {
            throw new NetplayException(NetplayErrorCode.ROOM_ALREADY_EXISTS);
        }

        PlayerConnection connection = liveConnection(connectionId);
        connection.updateLastSeen();
        leaveCurrentRoom(connection);

        NetplayPlayer owner = new NetplayPlayer(playerId, connectionId, text(extra, "player_name"), extra);
        String roomName = text(extra, "room_name");
        NetplayRoom room = new NetplayRoom(
                sessionId,
                owner,
                isBlank(roomName) ? "Room " + sessionId : roomName,
                orDefault(text(extra, "game_id"), DEFAULT_GAME_ID),
                orDefault(text(extra, "domain"), DEFAULT_DOMAIN),
                password,
                maxPlayers != null && maxPlayers > 0 ? maxPlayers : defaultMaxPlayers
        );

        synchronized (room) {
            if (!roomRegistry.create(room)) {
                throw new NetplayException(NetplayErrorCode.ROOM_ALREADY_EXISTS);
            }
            if (!connection.attach(sessionId, playerId)) {
                // disconnected after the lookup, the room has no live player
                roomRegistry.remove(sessionId);
                throw new NetplayException(NetplayErrorCode.CONNECTION_CLOSED);
            }
            log.info("Room {} opened by player {} (game: {}, max: {})",
                    sessionId, playerId, room.getGameId(), room.getMaxPlayers());
            broadcastPlayers(room);
            return room.playersSnapshot();
        }
    }

    /**
     * Seats the requesting connection in an existing room.
     *
     * <p>Re-joining with a player id that is already seated replaces the previous binding
     * (last writer wins). The connection that lost the binding is unsubscribed.
     *
     * @return the players of the room after the join
     * @throws NetplayException {@code INVALID_REQUEST}, {@code ROOM_NOT_FOUND},
     *                          {@code INCORRECT_PASSWORD}, {@code ROOM_FULL} or
     *                          {@code CONNECTION_CLOSED}
     */
    public Map<String, NetplayPlayer> joinRoom(String connectionId,
                                               Map<String, Object> extra,
                                               String password) {
        String sessionId = text(extra, "sessionid");
        String playerId = playerIdOf(extra);
        if (isBlank(sessionId) || isBlank(playerId)) {
            throw new NetplayException(NetplayErrorCode.INVALID_REQUEST);
        }

        NetplayRoom room = roomRegistry.get(sessionId)
                .orElseThrow(() -> new NetplayException(NetplayErrorCode.ROOM_NOT_FOUND));
        checkAdmission(room, password);

        PlayerConnection connection = liveConnection(connectionId);
        connection.updateLastSeen();
        Attachment current = connection.getAttachment();
        if (current != null && !current.equals(new Attachment(sessionId, playerId))) {
            leaveCurrentRoom(connection);
        }

        synchronized (room) {
            checkAdmission(room, password);
            // a disconnect that closes the connection from here on waits for this monitor
            if (!connection.attach(sessionId, playerId)) {
                throw new NetplayException(NetplayErrorCode.CONNECTION_CLOSED);
            }

            NetplayPlayer player = new NetplayPlayer(playerId, connectionId, text(extra, "player_name"), extra);
            NetplayPlayer replaced = room.seat(player);
            if (replaced != null && !replaced.getConnectionId().equals(connectionId)) {
                connectionRegistry.findById(replaced.getConnectionId())
                        .ifPresent(previous -> previous.detachIf(sessionId, playerId));
                log.info("Player {} in room {} moved from connection {} to {}",
                        playerId, sessionId, replaced.getConnectionId(), connectionId);
            }

            log.info("Player {} joined room {} ({}/{})",
                    playerId, sessionId, room.playerCount(), room.getMaxPlayers());
            broadcastPlayers(room);
            return room.playersSnapshot();
        }
    }

    /**
     * Explicit leave. The connection stays open and may open or join another room.
     */
    public void leaveRoom(String connectionId) {
        connectionRegistry.findById(connectionId).ifPresent(this::leaveCurrentRoom);
    }

    /**
     * Transport-level disconnect. Same cleanup as {@link #leaveRoom(String)}, then the
     * connection is forgotten. Repeated calls for the same connection are no-ops.
     */
    public void handleDisconnect(String connectionId) {
        Optional<PlayerConnection> removed = connectionRegistry.remove(connectionId);
        if (removed.isEmpty()) {
            log.debug("Disconnect for untracked connection {}", connectionId);
            return;
        }
        leave(connectionId, removed.get().close());
        log.debug("Connection {} closed", connectionId);
    }

    /**
     * Point-to-point relay of a WebRTC negotiation message.
     *
     * <p>Dropped silently if no target is given or the target is no longer connected.
     */
    public void relaySignal(String connectionId, SignalRequest signal) {
        if (signal == null || isBlank(signal.target())) {
            log.debug("Dropped signal from {} without target", connectionId);
            return;
        }
        connectionRegistry.findById(connectionId).ifPresent(PlayerConnection::updateLastSeen);

        String target = signal.target();
        if (!connectionRegistry.isConnected(target)) {
            log.debug("Dropped signal from {} to departed connection {}", connectionId, target);
            return;
        }

        if (signal.isRenegotiationRequest()) {
            messenger.sendToConnection(target, NetplayEventType.WEBRTC_SIGNAL, SignalDto.renegotiate(connectionId));
            return;
        }

        recordPeerLink(connectionId, target);
        messenger.sendToConnection(target, NetplayEventType.WEBRTC_SIGNAL, SignalDto.negotiation(connectionId, signal));
    }

    /**
     * Relays an opaque gameplay payload to every other subscriber of the sender's room.
     *
     * @param type one of {@code DATA_MESSAGE}, {@code SNAPSHOT}, {@code INPUT}
     */
    public void relayToRoom(String connectionId, NetplayEventType type, Object payload) {
        if (!ROOM_RELAY_TYPES.contains(type)) {
            throw new IllegalArgumentException("Not a room relay event: " + type);
        }

        Optional<PlayerConnection> connection = connectionRegistry.findById(connectionId);
        Attachment attachment = connection.map(PlayerConnection::getAttachment).orElse(null);
        if (attachment == null) {
            return;
        }
        connection.get().updateLastSeen();

        roomRegistry.get(attachment.sessionId()).ifPresent(room ->
                messenger.sendToEach(room.subscribersSnapshot(), connectionId, type, payload));
    }

    private void checkAdmission(NetplayRoom room, String password) {
        if (room.isClosed()) {
            throw new NetplayException(NetplayErrorCode.ROOM_NOT_FOUND);
        }
        if (!room.passwordMatches(password)) {
            throw new NetplayException(NetplayErrorCode.INCORRECT_PASSWORD);
        }
        if (room.isFull()) {
            throw new NetplayException(NetplayErrorCode.ROOM_FULL);
        }
    }

    /**
     * Connections are registered only by the transport's connect event. A request that
     * arrives after the disconnect was handled finds nothing here and is rejected.
     */
    private PlayerConnection liveConnection(String connectionId) {
        return connectionRegistry.findById(connectionId)
                .filter(connection -> !connection.isClosed())
                .orElseThrow(() -> new NetplayException(NetplayErrorCode.CONNECTION_CLOSED));
    }

    private void leaveCurrentRoom(PlayerConnection connection) {
        leave(connection.getConnectionId(), connection.detach());
    }

    private void leave(String connectionId, Attachment attachment) {
        if (attachment == null) {
            return;
        }

        Optional<NetplayRoom> maybeRoom = roomRegistry.get(attachment.sessionId());
        if (maybeRoom.isEmpty()) {
            return;
        }
        NetplayRoom room = maybeRoom.get();

        synchronized (room) {
            if (room.isClosed()) {
                return;
            }

            boolean unseated = room.unseat(attachment.playerId(), connectionId);
            room.pruneLinks(connectionId);
            room.unsubscribe(connectionId);
            if (!unseated) {
                // player id was taken over by another connection
                return;
            }

            log.info("Player {} left room {}", attachment.playerId(), room.getSessionId());
            broadcastPlayers(room);

            if (room.isEmpty()) {
                roomRegistry.remove(room.getSessionId());
                log.info("Room {} closed (last player left)", room.getSessionId());
            } else {
                room.reassignOwnerIfDeparted(connectionId).ifPresent(newOwner ->
                        log.info("Room {} ownership passed to connection {}", room.getSessionId(), newOwner));
            }
        }
    }

    private void recordPeerLink(String sourceConnectionId, String targetConnectionId) {
        Attachment attachment = connectionRegistry.findById(sourceConnectionId)
                .map(PlayerConnection::getAttachment)
                .orElse(null);
        if (attachment == null) {
            return;
        }
        roomRegistry.get(attachment.sessionId()).ifPresent(room -> {
            synchronized (room) {
                if (!room.isClosed() && room.isSubscribed(targetConnectionId)) {
                    room.recordLink(sourceConnectionId, targetConnectionId);
                }
            }
        });
    }

    /**
     * Sends the full player map to every subscriber. Caller holds the room's monitor.
     */
    private void broadcastPlayers(NetplayRoom room) {
        Map<String, PlayerDto> players = PlayerDto.fromPlayers(room.playersSnapshot());
        messenger.sendToEach(room.subscribersSnapshot(), null, NetplayEventType.USERS_UPDATED, players);
    }

    private static String playerIdOf(Map<String, Object> extra) {
        String userId = text(extra, "userid");
        return isBlank(userId) ? text(extra, "playerId") : userId;
    }

    private static String text(Map<String, Object> extra, String key) {
        if (extra == null) {
            return null;
        }
        Object value = extra.get(key);
        return value == null ? null : value.toString();
    }

    private static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
