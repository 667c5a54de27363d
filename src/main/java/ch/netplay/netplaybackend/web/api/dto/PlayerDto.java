package ch.netplay.netplaybackend.web.api.dto;

import ch.netplay.netplaybackend.domain.NetplayPlayer;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a {@code users-updated} event.
 *
 * <p>Serialized flat: the client's own metadata keys plus {@code connectionId}, so peers
 * can address each other in WebRTC signals. The server-assigned {@code connectionId}
 * always wins over a client key of the same name.
 *
 * @param connectionId connection currently bound to the player
 * @param metadata     opaque client metadata, echoed back apart from {@code connectionId}
 */
public record PlayerDto(
        String connectionId,
        @JsonIgnore Map<String, Object> metadata
) {
    static final String CONNECTION_ID = "connectionId";

    public static PlayerDto from(NetplayPlayer player) {
        return new PlayerDto(player.getConnectionId(), player.getMetadata());
    }

    /**
     * Client metadata without a {@code connectionId} key, which would clash with the
     * server-assigned one.
     */
    @JsonAnyGetter
    public Map<String, Object> flattenedMetadata() {
        if (metadata == null) {
            return Map.of();
        }
        Map<String, Object> flattened = new LinkedHashMap<>(metadata);
        flattened.remove(CONNECTION_ID);
        return flattened;
    }

    public static Map<String, PlayerDto> fromPlayers(Map<String, NetplayPlayer> players) {
        Map<String, PlayerDto> result = new LinkedHashMap<>();
        players.forEach((playerId, player) -> result.put(playerId, from(player)));
        return result;
    }
}
