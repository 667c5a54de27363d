package ch.netplay.netplaybackend.web.api.dto;

/**
 * Effective reaper configuration.
 *
 * @param reaperIntervalMs      sweep interval in milliseconds
 * @param reaperIntervalSeconds sweep interval in seconds
 */
public record ReaperConfigDto(
        long reaperIntervalMs,
        double reaperIntervalSeconds
) {
}
