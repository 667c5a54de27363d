package ch.netplay.netplaybackend.service;

import ch.netplay.netplaybackend.domain.enums.NetplayEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Delivers outbound netplay events to individual connections.
 *
 * <p>Connections are anonymous, so each one is addressed through the user destination
 * resolved from its STOMP session id ({@code /user/queue/netplay.*} on the client side).
 *
 * <p>Delivery is fire-and-forget: the message is handed to the broker and the
 * executor-backed outbound channel, so the caller never waits on the recipient. A failed
 * hand-off is logged and dropped. No retry, no buffering.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NetplayMessenger {

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Sends one event to one connection.
     *
     * @param connectionId STOMP session id of the recipient
     * @param type         event kind, selects the destination queue
     * @param payload      message body, serialized as JSON
     */
    public void sendToConnection(String connectionId, NetplayEventType type, Object payload) {
        try {
            messagingTemplate.convertAndSendToUser(
                    connectionId,
                    type.getDestination(),
                    payload,
                    headersFor(connectionId)
            );
        } catch (MessagingException e) {
            log.debug("Dropped {} for connection {}: {}", type, connectionId, e.getMessage());
        }
    }

    /**
     * Sends the same event to every listed connection except {@code excludedConnectionId}.
     */
    public void sendToEach(Collection<String> connectionIds, String excludedConnectionId,
                           NetplayEventType type, Object payload) {
        for (String connectionId : connectionIds) {
            if (!connectionId.equals(excludedConnectionId)) {
                sendToConnection(connectionId, type, payload);
            }
        }
    }

    private MessageHeaders headersFor(String connectionId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(connectionId);
        accessor.setLeaveMutable(true);
        return accessor.getMessageHeaders();
    }
}
