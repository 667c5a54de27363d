package ch.netplay.netplaybackend.domain.enums;

/**
 * Reasons a room request can be rejected.
 *
 * <p>The message of each code is what clients receive in the {@code error} field of a
 * negative acknowledgement.
 */
public enum NetplayErrorCode {

    /**
     * Session id or player id missing from the request.
     */
    INVALID_REQUEST("Invalid data"),

    /**
     * A room with the requested session id is already open.
     */
    ROOM_ALREADY_EXISTS("Room already exists"),

    /**
     * No open room with the requested session id.
     */
    ROOM_NOT_FOUND("Room not found"),

    /**
     * The room is password protected and the supplied password does not match.
     */
    INCORRECT_PASSWORD("Incorrect password"),

    /**
     * The room already holds {@code maxPlayers} players.
     */
    ROOM_FULL("Room full"),

    /**
     * The requesting connection is not live: it was never established or has already
     * disconnected.
     */
    CONNECTION_CLOSED("Connection closed");

    private final String message;

    NetplayErrorCode(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
