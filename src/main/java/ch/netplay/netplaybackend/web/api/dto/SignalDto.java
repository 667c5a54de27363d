package ch.netplay.netplaybackend.web.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Relayed WebRTC signal as delivered to the target connection.
 *
 * @param sender connection id of the peer that sent the signal
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SignalDto(
        String sender,
        JsonNode candidate,
        JsonNode offer,
        JsonNode answer,
        Boolean requestRenegotiate
) {
    public static SignalDto renegotiate(String sender) {
        return new SignalDto(sender, null, null, null, Boolean.TRUE);
    }

    public static SignalDto negotiation(String sender, SignalRequest request) {
        return new SignalDto(sender, request.candidate(), request.offer(), request.answer(), null);
    }
}
