package ch.netplay.netplaybackend.web.api.dto;

import java.util.Map;

/**
 * Payload of {@code /app/netplay.join-room}.
 *
 * @param requestId client correlation id echoed in the acknowledgement
 * @param extra     must carry {@code sessionid} and {@code userid} (or {@code playerId})
 * @param password  password of a protected room
 */
public record JoinRoomRequest(
        String requestId,
        Map<String, Object> extra,
        String password
) {}
