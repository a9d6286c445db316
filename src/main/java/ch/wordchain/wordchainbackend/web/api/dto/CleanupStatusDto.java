package ch.wordchain.wordchainbackend.web.api.dto;

import java.time.Instant;

/**
 * DTO representing how many rooms are currently eligible for cleanup.
 *
 * @param totalRooms registered rooms
 * @param idleRooms rooms without activity since the threshold
 * @param recentRooms rooms with recent activity
 * @param idleMinutes the inactivity threshold in minutes
 * @param thresholdTimestamp the exact timestamp used as threshold
 */
public record CleanupStatusDto(
        int totalRooms,
        long idleRooms,
        long recentRooms,
        int idleMinutes,
        Instant thresholdTimestamp
) {
}
