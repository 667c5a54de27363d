package ch.netplay.netplaybackend.domain;

/**
 * A signaling pair seen by the relay. Stored directed, matched on either side.
 */
public record PeerLink(
        String sourceConnectionId,
        String targetConnectionId
) {
    public boolean involves(String connectionId) {
        return sourceConnectionId.equals(connectionId) || targetConnectionId.equals(connectionId);
    }
}
