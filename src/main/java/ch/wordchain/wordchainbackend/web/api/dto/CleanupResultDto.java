package ch.wordchain.wordchainbackend.web.api.dto;

/**
 * DTO representing the result of a manual cleanup operation.
 *
 * @param message human-readable status message
 * @param stoppedRooms number of idle rooms that were stopped
 * @param roomsBefore registered rooms before cleanup
 * @param roomsAfter registered rooms after cleanup
 * @param idleMinutes the inactivity threshold used (in minutes)
 */
public record CleanupResultDto(
        String message,
        long stoppedRooms,
        long roomsBefore,
        long roomsAfter,
        int idleMinutes
) {
}
