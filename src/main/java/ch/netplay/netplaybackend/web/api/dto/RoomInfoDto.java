package ch.netplay.netplaybackend.web.api.dto;

import ch.netplay.netplaybackend.domain.NetplayRoom;

import java.time.Instant;
import java.util.List;

/**
 * Debug view of one room. Omits the password.
 */
public record RoomInfoDto(
        String sessionId,
        String roomName,
        String gameId,
        String domain,
        String ownerConnectionId,
        List<String> playerIds,
        int maxPlayers,
        boolean hasPassword,
        int peerLinks,
        Instant createdAt
) {
    public static RoomInfoDto from(NetplayRoom room) {
        synchronized (room) {
            return new RoomInfoDto(
                    room.getSessionId(),
                    room.getRoomName(),
                    room.getGameId(),
                    room.getDomain(),
                    room.getOwnerConnectionId(),
                    List.copyOf(room.playersSnapshot().keySet()),
                    room.getMaxPlayers(),
                    room.hasPassword(),
                    room.peersSnapshot().size(),
                    room.getCreatedAt()
            );
        }
    }
}
