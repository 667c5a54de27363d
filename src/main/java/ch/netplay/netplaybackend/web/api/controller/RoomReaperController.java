package ch.netplay.netplaybackend.web.api.controller;

import ch.netplay.netplaybackend.domain.NetplayRoom;
import ch.netplay.netplaybackend.domain.PlayerConnection;
import ch.netplay.netplaybackend.repository.ConnectionRegistry;
import ch.netplay.netplaybackend.repository.RoomRegistry;
import ch.netplay.netplaybackend.service.RoomReaperService;
import ch.netplay.netplaybackend.web.api.dto.ReaperConfigDto;
import ch.netplay.netplaybackend.web.api.dto.ReaperStatusDto;
import ch.netplay.netplaybackend.web.api.dto.RoomInfoDto;
import ch.netplay.netplaybackend.web.api.dto.SweepResultDto;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Development-only REST controller for inspecting rooms and running the reaper by hand.
 *
 * <p>Only available with the {@code dev} or {@code test} profile. Never expose it in
 * production: it lists session ids and connection ids of live rooms.
 */
@RestController
@RequestMapping("/api/dev/netplay")
@RequiredArgsConstructor
@Profile({"dev", "test"})
public class RoomReaperController {

    private final RoomReaperService reaperService;
    private final RoomRegistry roomRegistry;
    private final ConnectionRegistry connectionRegistry;

    /**
     * Runs the empty-room sweep immediately.
     *
     * <p>Example response:
     * <pre>
     * {
     *   "message": "Sweep completed",
     *   "removedCount": 1,
     *   "roomsBefore": 3,
     *   "roomsAfter": 2
     * }
     * </pre>
     */
    @PostMapping("/sweep")
    @Operation(summary = "Runs the empty-room sweep immediately")
    public ResponseEntity<SweepResultDto> triggerSweep() {
        long before = roomRegistry.count();
        int removed = reaperService.triggerSweep();
        long after = roomRegistry.count();

        return ResponseEntity.ok(new SweepResultDto("Sweep completed", removed, before, after));
    }

    @GetMapping("/status")
    @Operation(summary = "Counts rooms and connections")
    public ResponseEntity<ReaperStatusDto> getStatus() {
        List<NetplayRoom> rooms = roomRegistry.findAll();
        long emptyRooms = rooms.stream().filter(NetplayRoom::isEmpty).count();

        List<PlayerConnection> connections = connectionRegistry.findAll();
        long attached = connections.stream().filter(PlayerConnection::isAttached).count();

        return ResponseEntity.ok(new ReaperStatusDto(rooms.size(), emptyRooms, connections.size(), attached));
    }

    @GetMapping("/config")
    @Operation(summary = "Gets the current reaper configuration")
    public ResponseEntity<ReaperConfigDto> getConfig() {
        long intervalMs = reaperService.getReaperIntervalMs();
        return ResponseEntity.ok(new ReaperConfigDto(intervalMs, intervalMs / 1000.0));
    }

    @GetMapping("/rooms")
    @Operation(summary = "Lists all open rooms with owner and peer details")
    public ResponseEntity<List<RoomInfoDto>> getRooms() {
        List<RoomInfoDto> rooms = roomRegistry.findAll().stream()
                .map(RoomInfoDto::from)
                .toList();
        return ResponseEntity.ok(rooms);
    }
}
