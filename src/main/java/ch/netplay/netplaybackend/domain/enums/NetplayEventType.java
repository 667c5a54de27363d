package ch.netplay.netplaybackend.domain.enums;

/**
 * Outbound event kinds and the per-connection queue each one is delivered on.
 *
 * <p>Clients subscribe to {@code /user/queue/netplay.*}; the server addresses a single
 * connection through the user destination resolved from its STOMP session id.
 */
public enum NetplayEventType {

    ACK("/queue/netplay.ack"),
    USERS_UPDATED("/queue/netplay.users-updated"),
    WEBRTC_SIGNAL("/queue/netplay.webrtc-signal"),
    DATA_MESSAGE("/queue/netplay.data-message"),
    SNAPSHOT("/queue/netplay.snapshot"),
    INPUT("/queue/netplay.input");

    private final String destination;

    NetplayEventType(String destination) {
        this.destination = destination;
    }

    public String getDestination() {
        return destination;
    }
}
