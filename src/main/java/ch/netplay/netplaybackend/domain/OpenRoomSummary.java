package ch.netplay.netplaybackend.domain;

/**
 * Discovery view of a joinable room. Carries whether a password is set, never the password.
 */
public record OpenRoomSummary(
        String sessionId,
        String roomName,
        int currentCount,
        int maxPlayers,
        String ownerDisplayName,
        boolean hasPassword
) {
    public static final String UNKNOWN_OWNER = "Unknown";

    public static OpenRoomSummary from(NetplayRoom room) {
        synchronized (room) {
            String ownerName = room.findOwner()
                    .map(NetplayPlayer::getDisplayName)
                    .filter(name -> !name.isBlank())
                    .orElse(UNKNOWN_OWNER);
            return new OpenRoomSummary(
                    room.getSessionId(),
                    room.getRoomName(),
                    room.playerCount(),
                    room.getMaxPlayers(),
                    ownerName,
                    room.hasPassword()
            );
        }
    }
}
