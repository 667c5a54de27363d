package ch.netplay.netplaybackend.web.api.dto;

/**
 * Response of the health endpoint.
 *
 * @param status          static {@code "OK"} while the context is alive
 * @param activeRooms     rooms currently open
 * @param liveConnections WebSocket connections currently tracked
 */
public record HealthDto(
        String status,
        int activeRooms,
        int liveConnections
) {
}
