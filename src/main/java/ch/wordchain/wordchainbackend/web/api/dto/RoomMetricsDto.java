package ch.wordchain.wordchainbackend.web.api.dto;

import ch.wordchain.wordchainbackend.domain.RoomMetrics;

import java.time.Instant;

/**
 * Activity metrics of one room.
 */
public record RoomMetricsDto(
        String roomId,
        int playerCount,
        Instant startedAt,
        long elapsedSeconds,
        int turnsTaken,
        int wordsAccepted,
        int timeouts,
        int errors,
        Instant lastActivity
) {

    public static RoomMetricsDto from(RoomMetrics metrics) {
        return new RoomMetricsDto(
                metrics.getRoomId(),
                metrics.getPlayerCount(),
                metrics.getStartedAt(),
                metrics.elapsed().toSeconds(),
                metrics.getTurnsTaken(),
                metrics.getWordsAccepted(),
                metrics.getTimeouts(),
                metrics.getErrors(),
                metrics.getLastActivity()
        );
    }
}
