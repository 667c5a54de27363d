package ch.netplay.netplaybackend.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A player seated in a {@link NetplayRoom}.
 *
 * <p>The metadata is whatever the client sent in its {@code extra} object and is echoed
 * back untouched in membership updates.
 */
@Getter
public class NetplayPlayer {

    private final String playerId;
    private final String connectionId;
    private final String displayName;
    private final Map<String, Object> metadata;
    private final Instant joinedAt;

    public NetplayPlayer(String playerId, String connectionId, String displayName, Map<String, Object> metadata) {
        this.playerId = Objects.requireNonNull(playerId);
        this.connectionId = Objects.requireNonNull(connectionId);
        this.displayName = displayName;
        this.metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.joinedAt = Instant.now();
    }
}
