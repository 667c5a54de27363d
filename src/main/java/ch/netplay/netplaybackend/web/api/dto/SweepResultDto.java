package ch.netplay.netplaybackend.web.api.dto;

/**
 * DTO representing the result of a manual reaper run.
 *
 * @param message      human-readable status message
 * @param removedCount number of empty rooms that were removed
 * @param roomsBefore  open rooms before the sweep
 * @param roomsAfter   open rooms after the sweep
 */
public record SweepResultDto(
        String message,
        long removedCount,
        long roomsBefore,
        long roomsAfter
) {
}
