package ch.netplay.netplaybackend.domain.exception;

import ch.netplay.netplaybackend.domain.enums.NetplayErrorCode;

/**
 * Thrown when a room request is rejected by policy (capacity, password, identifiers).
 *
 * <p>Never fatal: the WebSocket layer turns it into a negative acknowledgement for the
 * requesting connection.
 */
public class NetplayException extends RuntimeException {

    private final NetplayErrorCode errorCode;

    public NetplayException(NetplayErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public NetplayErrorCode getErrorCode() {
        return errorCode;
    }
}
