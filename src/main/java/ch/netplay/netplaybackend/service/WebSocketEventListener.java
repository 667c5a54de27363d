package ch.netplay.netplaybackend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Feeds WebSocket lifecycle events into the netplay coordinator.
 *
 * <p>A STOMP session becomes a live connection once the broker has acknowledged its
 * CONNECT. A closed session (tab closed, network loss, explicit DISCONNECT, heartbeat
 * timeout) runs the same cleanup as an explicit leave-room.
 *
 * <p>Spring may publish more than one disconnect event for the same session; the
 * coordinator treats repeats as no-ops.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketEventListener {

    private final NetplaySessionService sessionService;

    @EventListener
    public void handleConnected(SessionConnectedEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = accessor.getSessionId();
        if (sessionId == null) {
            return;
        }
        sessionService.handleConnect(sessionId);
    }

    @EventListener
    public void handleDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId == null) {
            return;
        }
        log.debug("WebSocket session {} closed ({})", sessionId, event.getCloseStatus());
        sessionService.handleDisconnect(sessionId);
    }
}
