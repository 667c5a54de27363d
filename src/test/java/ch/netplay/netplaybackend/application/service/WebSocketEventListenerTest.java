package ch.netplay.netplaybackend.application.service;

import ch.netplay.netplaybackend.service.NetplaySessionService;
import ch.netplay.netplaybackend.service.WebSocketEventListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link WebSocketEventListener}.
 *
 * <p>Focus areas:
 * <ul>
 *   <li>Connection registration on CONNECTED</li>
 *   <li>Disconnect cleanup, including repeated disconnect events</li>
 * </ul>
 *
 * <p>Notes:
 * <ul>
 *   <li>Events are built from real STOMP headers; the coordinator is mocked</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class WebSocketEventListenerTest {

    @Mock
    private NetplaySessionService sessionService;

    @InjectMocks
    private WebSocketEventListener listener;

    // ------------------------------------------------------------------------------------
    // handleConnected
    // ------------------------------------------------------------------------------------

    @Test
    void handleConnected_shouldRegisterConnection() {
        // Arrange
        SessionConnectedEvent event = new SessionConnectedEvent(this, stompMessage(StompCommand.CONNECTED, "session-001"));

        // Act
        listener.handleConnected(event);

        // Assert
        verify(sessionService).handleConnect("session-001");
        verifyNoMoreInteractions(sessionService);
    }

    @Test
    void handleConnected_shouldIgnoreEvent_whenSessionIdMissing() {
        SessionConnectedEvent event = new SessionConnectedEvent(this, stompMessage(StompCommand.CONNECTED, null));

        listener.handleConnected(event);

        verifyNoInteractions(sessionService);
    }

    // ------------------------------------------------------------------------------------
    // handleDisconnect
    // ------------------------------------------------------------------------------------

    @Test
    void handleDisconnect_shouldRunCleanup_forClosedSession() {
        // Arrange
        SessionDisconnectEvent event = disconnectEvent("session-001", CloseStatus.GOING_AWAY);

        // Act
        listener.handleDisconnect(event);

        // Assert
        verify(sessionService).handleDisconnect("session-001");
    }

    @Test
    void handleDisconnect_shouldForwardRepeatedEvents_forCoordinatorToDeduplicate() {
        listener.handleDisconnect(disconnectEvent("session-001", CloseStatus.NORMAL));
        listener.handleDisconnect(disconnectEvent("session-001", CloseStatus.NORMAL));

        verify(sessionService, times(2)).handleDisconnect("session-001");
    }

    // ------------------------------------------------------------------------------------
    // Helper Methods
    // ------------------------------------------------------------------------------------

    private static Message<byte[]> stompMessage(StompCommand command, String sessionId) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(command);
        if (sessionId != null) {
            accessor.setSessionId(sessionId);
        }
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }

    private SessionDisconnectEvent disconnectEvent(String sessionId, CloseStatus status) {
        return new SessionDisconnectEvent(this, stompMessage(StompCommand.DISCONNECT, sessionId), sessionId, status);
    }
}
