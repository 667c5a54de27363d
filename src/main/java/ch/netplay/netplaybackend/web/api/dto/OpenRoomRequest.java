package ch.netplay.netplaybackend.web.api.dto;

import java.util.Map;

/**
 * Payload of {@code /app/netplay.open-room}.
 *
 * <p>{@code extra} must carry {@code sessionid} and {@code userid} (or {@code playerId});
 * {@code room_name}, {@code game_id}, {@code domain} and {@code player_name} are optional.
 *
 * @param requestId  client correlation id echoed in the acknowledgement
 * @param extra      room and player metadata
 * @param password   optional room password
 * @param maxPlayers optional capacity (default 4)
 */
public record OpenRoomRequest(
        String requestId,
        Map<String, Object> extra,
        String password,
        Integer maxPlayers
) {}
