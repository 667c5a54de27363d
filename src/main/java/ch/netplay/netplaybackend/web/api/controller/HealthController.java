package ch.netplay.netplaybackend.web.api.controller;

import ch.netplay.netplaybackend.repository.ConnectionRegistry;
import ch.netplay.netplaybackend.repository.RoomRegistry;
import ch.netplay.netplaybackend.web.api.dto.HealthDto;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe for containers and load balancers.
 *
 * <p>Reports the in-memory room and connection counts alongside the status; there are no
 * downstream dependencies to check.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final RoomRegistry roomRegistry;
    private final ConnectionRegistry connectionRegistry;

    public HealthController(RoomRegistry roomRegistry, ConnectionRegistry connectionRegistry) {
        this.roomRegistry = roomRegistry;
        this.connectionRegistry = connectionRegistry;
    }

    @GetMapping("/health")
    public HealthDto health() {
        return new HealthDto("OK", roomRegistry.count(), connectionRegistry.count());
    }
}
