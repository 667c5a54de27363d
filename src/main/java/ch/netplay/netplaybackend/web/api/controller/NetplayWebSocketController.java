package ch.netplay.netplaybackend.web.api.controller;

import ch.netplay.netplaybackend.domain.NetplayPlayer;
import ch.netplay.netplaybackend.domain.enums.NetplayEventType;
import ch.netplay.netplaybackend.domain.exception.NetplayException;
import ch.netplay.netplaybackend.service.NetplayMessenger;
import ch.netplay.netplaybackend.service.NetplaySessionService;
import ch.netplay.netplaybackend.web.api.dto.JoinRoomRequest;
import ch.netplay.netplaybackend.web.api.dto.OpenRoomRequest;
import ch.netplay.netplaybackend.web.api.dto.PlayerDto;
import ch.netplay.netplaybackend.web.api.dto.RoomAckDto;
import ch.netplay.netplaybackend.web.api.dto.SignalRequest;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.util.Map;
import java.util.Objects;

/**
 * STOMP entry points for netplay clients.
 *
 * <p>Clients send to {@code /app/netplay.*}. The STOMP session id is the connection id
 * used throughout the coordinator. Room requests are answered on
 * {@code /user/queue/netplay.ack}; relays produce no reply.
 */
@Controller
@Slf4j
public class NetplayWebSocketController {

    private final NetplaySessionService sessionService;
    private final NetplayMessenger messenger;

    public NetplayWebSocketController(NetplaySessionService sessionService,
                                      NetplayMessenger messenger) {
        this.sessionService = sessionService;
        this.messenger = messenger;
    }

    @MessageMapping("/netplay.open-room")
    public void openRoom(@Payload OpenRoomRequest request, SimpMessageHeaderAccessor sha) {
        String connectionId = connectionIdOf(sha);
        RoomAckDto ack;
        try {
            sessionService.openRoom(connectionId, request.extra(), request.password(), request.maxPlayers());
            ack = RoomAckDto.success(request.requestId());
        } catch (NetplayException e) {
            log.warn("open-room rejected for connection {}: {}", connectionId, e.getMessage());
            ack = RoomAckDto.failure(request.requestId(), e.getErrorCode());
        }
        messenger.sendToConnection(connectionId, NetplayEventType.ACK, ack);
    }

    @MessageMapping("/netplay.join-room")
    public void joinRoom(@Payload JoinRoomRequest request, SimpMessageHeaderAccessor sha) {
        String connectionId = connectionIdOf(sha);
        RoomAckDto ack;
        try {
            Map<String, NetplayPlayer> players =
                    sessionService.joinRoom(connectionId, request.extra(), request.password());
            ack = RoomAckDto.success(request.requestId(), PlayerDto.fromPlayers(players));
        } catch (NetplayException e) {
            log.warn("join-room rejected for connection {}: {}", connectionId, e.getMessage());
            ack = RoomAckDto.failure(request.requestId(), e.getErrorCode());
        }
        messenger.sendToConnection(connectionId, NetplayEventType.ACK, ack);
    }

    @MessageMapping("/netplay.leave-room")
    public void leaveRoom(SimpMessageHeaderAccessor sha) {
        sessionService.leaveRoom(connectionIdOf(sha));
    }

    @MessageMapping("/netplay.webrtc-signal")
    public void webrtcSignal(@Payload SignalRequest signal, SimpMessageHeaderAccessor sha) {
        sessionService.relaySignal(connectionIdOf(sha), signal);
    }

    @MessageMapping("/netplay.data-message")
    public void dataMessage(@Payload JsonNode payload, SimpMessageHeaderAccessor sha) {
        sessionService.relayToRoom(connectionIdOf(sha), NetplayEventType.DATA_MESSAGE, payload);
    }

    @MessageMapping("/netplay.snapshot")
    public void snapshot(@Payload JsonNode payload, SimpMessageHeaderAccessor sha) {
        sessionService.relayToRoom(connectionIdOf(sha), NetplayEventType.SNAPSHOT, payload);
    }

    @MessageMapping("/netplay.input")
    public void input(@Payload JsonNode payload, SimpMessageHeaderAccessor sha) {
        sessionService.relayToRoom(connectionIdOf(sha), NetplayEventType.INPUT, payload);
    }

    private String connectionIdOf(SimpMessageHeaderAccessor sha) {
        return Objects.requireNonNull(sha.getSessionId(), "STOMP session id missing");
    }
}
