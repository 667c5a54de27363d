package ch.netplay.netplaybackend.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.Objects;

/**
 * Tracks one live transport connection and the room it is attached to.
 *
 * <p>A connection is either unattached or attached to exactly one room under one
 * player id:
 * <pre>
 * Unattached -> Attached(sessionId, playerId) -> Unattached
 * </pre>
 *
 * <p>Once the transport reports the connection as gone it is closed and can never be
 * attached again.
 *
 * <p>The connection id is the STOMP session id assigned by the WebSocket layer.
 */
@Getter
public class PlayerConnection {

    /**
     * Room binding of an attached connection.
     */
    public record Attachment(String sessionId, String playerId) {
    }

    private final String connectionId;

    /**
     * Time the transport reported the connection as established.
     */
    private final Instant connectedAt;

    /**
     * Last inbound activity. Updated on every handled request.
     */
    private volatile Instant lastSeen;

    private Attachment attachment;

    private boolean closed;

    public PlayerConnection(String connectionId) {
        this.connectionId = Objects.requireNonNull(connectionId);
        this.connectedAt = Instant.now();
        this.lastSeen = connectedAt;
    }

    public synchronized Attachment getAttachment() {
        return attachment;
    }

    public synchronized boolean isAttached() {
        return attachment != null;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Binds the connection to a room, replacing any previous binding.
     *
     * @return {@code false} if the connection is already closed and nothing was bound
     */
    public synchronized boolean attach(String sessionId, String playerId) {
        if (closed) {
            return false;
        }
        this.attachment = new Attachment(sessionId, playerId);
        return true;
    }

    /**
     * Marks the connection closed and clears its binding.
     *
     * @return the binding that was cleared, or {@code null} if the connection was unattached
     */
    public synchronized Attachment close() {
        closed = true;
        return detach();
    }

    /**
     * Clears the binding unconditionally.
     *
     * @return the binding that was cleared, or {@code null} if the connection was unattached
     */
    public synchronized Attachment detach() {
        Attachment previous = this.attachment;
        this.attachment = null;
        return previous;
    }

    /**
     * Clears the binding only if it still points at the given room and player.
     * Used when another connection takes over the player id.
     */
    public synchronized boolean detachIf(String sessionId, String playerId) {
        if (attachment != null
                && attachment.sessionId().equals(sessionId)
                && attachment.playerId().equals(playerId)) {
            attachment = null;
            return true;
        }
        return false;
    }

    public void updateLastSeen() {
        this.lastSeen = Instant.now();
    }
}
