package ch.netplay.netplaybackend.web.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Payload of {@code /app/netplay.webrtc-signal}. The negotiation fields are opaque.
 */
public record SignalRequest(
        String target,
        JsonNode candidate,
        JsonNode offer,
        JsonNode answer,
        Boolean requestRenegotiate
) {
    public boolean isRenegotiationRequest() {
        return Boolean.TRUE.equals(requestRenegotiate);
    }
}
