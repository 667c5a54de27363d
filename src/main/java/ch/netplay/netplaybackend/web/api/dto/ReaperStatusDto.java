package ch.netplay.netplaybackend.web.api.dto;

/**
 * Snapshot of registry state, as seen by the dev status endpoint.
 *
 * @param activeRooms          rooms currently in the registry
 * @param emptyRooms           rooms the next sweep would remove
 * @param liveConnections      connections the transport reports as open
 * @param attachedConnections  live connections currently seated in a room
 */
public record ReaperStatusDto(
        long activeRooms,
        long emptyRooms,
        long liveConnections,
        long attachedConnections
) {
}
