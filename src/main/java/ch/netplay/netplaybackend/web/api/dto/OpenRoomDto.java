package ch.netplay.netplaybackend.web.api.dto;

import ch.netplay.netplaybackend.domain.OpenRoomSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of the {@code GET /list} response, keyed by session id in the enclosing map.
 */
public record OpenRoomDto(
        @JsonProperty("room_name") String roomName,
        int current,
        int max,
        @JsonProperty("player_name") String playerName,
        boolean hasPassword
) {
    public static OpenRoomDto from(OpenRoomSummary summary) {
        return new OpenRoomDto(
                summary.roomName(),
                summary.currentCount(),
                summary.maxPlayers(),
                summary.ownerDisplayName(),
                summary.hasPassword()
        );
    }
}
