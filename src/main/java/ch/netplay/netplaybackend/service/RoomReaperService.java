package ch.netplay.netplaybackend.service;

import ch.netplay.netplaybackend.repository.RoomRegistry;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically removes netplay rooms that have no players left.
 *
 * <p>Rooms are normally closed the moment their last player leaves. This sweep only
 * catches rooms that lost their players without a clean leave or disconnect. It runs
 * alongside live traffic; the registry re-checks emptiness under each room's monitor.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code netplay.reaper.interval-ms}: how often to sweep (default: 60000 ms)</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Getter
public class RoomReaperService {

    private final RoomRegistry roomRegistry;

    /**
     * How often the sweep runs (in milliseconds).
     */
    @Value("${netplay.reaper.interval-ms:60000}")
    private long reaperIntervalMs;

    /**
     * Scheduled sweep of empty rooms.
     *
     * <p>Logs at INFO only when something was removed.
     */
    @Scheduled(fixedRateString = "${netplay.reaper.interval-ms:60000}")
    public void sweepEmptyRooms() {
        sweep();
    }

    /**
     * Runs the sweep outside the schedule (dev endpoint, tests).
     *
     * @return number of rooms removed
     */
    public int triggerSweep() {
        return sweep();
    }

    private int sweep() {
        int removed = roomRegistry.sweepEmpty();
        if (removed > 0) {
            log.info("Reaper removed {} empty room(s), {} room(s) remain", removed, roomRegistry.count());
        } else {
            log.debug("Reaper found no empty rooms");
        }
        return removed;
    }
}
