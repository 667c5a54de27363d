package ch.netplay.netplaybackend.web.api.dto;

import ch.netplay.netplaybackend.domain.enums.NetplayErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Reply to an {@code open-room} or {@code join-room} request, sent only to the requester.
 *
 * @param requestId echo of the client's correlation id (may be null)
 * @param ok        whether the request succeeded
 * @param error     human-readable rejection reason, null on success
 * @param players   current players after a successful join, null otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomAckDto(
        String requestId,
        boolean ok,
        String error,
        Map<String, PlayerDto> players
) {
    public static RoomAckDto success(String requestId) {
        return new RoomAckDto(requestId, true, null, null);
    }

    public static RoomAckDto success(String requestId, Map<String, PlayerDto> players) {
        return new RoomAckDto(requestId, true, null, players);
    }

    public static RoomAckDto failure(String requestId, NetplayErrorCode errorCode) {
        return new RoomAckDto(requestId, false, errorCode.getMessage(), null);
    }
}
