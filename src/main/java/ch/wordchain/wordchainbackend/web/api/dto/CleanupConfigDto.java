package ch.wordchain.wordchainbackend.web.api.dto;

/**
 * DTO representing the current cleanup configuration settings.
 *
 * @param cleanupIntervalMs how often cleanup runs (in milliseconds)
 * @param cleanupIntervalMinutes how often cleanup runs (in minutes, for readability)
 * @param idleMinutes inactivity threshold for stopping a room
 * @param lockIdleHours inactivity threshold for reclaiming a room gate
 */
public record CleanupConfigDto(
        long cleanupIntervalMs,
        double cleanupIntervalMinutes,
        int idleMinutes,
        int lockIdleHours
) {
}
