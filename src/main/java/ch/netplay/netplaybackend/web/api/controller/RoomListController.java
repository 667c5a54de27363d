package ch.netplay.netplaybackend.web.api.controller;

import ch.netplay.netplaybackend.domain.OpenRoomSummary;
import ch.netplay.netplaybackend.repository.RoomRegistry;
import ch.netplay.netplaybackend.web.api.dto.OpenRoomDto;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Room discovery for netplay clients.
 */
@RestController
public class RoomListController {

    private final RoomRegistry roomRegistry;

    public RoomListController(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    /**
     * Lists rooms of a game that still have a free seat, keyed by session id.
     *
     * <p>Example response:
     * <pre>
     * {
     *   "abc-123": {
     *     "room_name": "Friday night",
     *     "current": 1,
     *     "max": 4,
     *     "player_name": "Alice",
     *     "hasPassword": false
     *   }
     * }
     * </pre>
     */
    @Operation(summary = "Lists joinable netplay rooms for a game")
    @GetMapping("/list")
    public Map<String, OpenRoomDto> listOpenRooms(@RequestParam(name = "game_id", required = false) String gameId) {
        Map<String, OpenRoomDto> result = new LinkedHashMap<>();
        for (OpenRoomSummary summary : roomRegistry.listOpen(gameId)) {
            result.put(summary.sessionId(), OpenRoomDto.from(summary));
        }
        return result;
    }
}
