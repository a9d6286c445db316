package ch.wordchain.wordchainbackend.web.api.controller;

import ch.wordchain.wordchainbackend.domain.RoomMetrics;
import ch.wordchain.wordchainbackend.service.RoomCleanupService;
import ch.wordchain.wordchainbackend.service.RoomMetricsTracker;
import ch.wordchain.wordchainbackend.service.RoomRegistry;
import ch.wordchain.wordchainbackend.web.api.dto.CleanupConfigDto;
import ch.wordchain.wordchainbackend.web.api.dto.CleanupResultDto;
import ch.wordchain.wordchainbackend.web.api.dto.CleanupStatusDto;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Development-only REST controller for manual room cleanup.
 *
 * <p>This controller is only available when the 'dev' or 'test' profile is active.
 *
 * <p><b>WARNING:</b> These endpoints are for development and testing purposes only.
 * They should never be exposed in production environments.
 */
@RestController
@RequestMapping("/api/dev/cleanup")
@RequiredArgsConstructor
@Profile({"dev", "test"})
public class RoomCleanupController {

    private final RoomCleanupService cleanupService;
    private final RoomRegistry roomRegistry;
    private final RoomMetricsTracker metricsTracker;

    /**
     * Manually triggers the idle room sweep.
     *
     * <p>Example response:
     * <pre>
     * {
     *   "message": "Cleanup completed",
     *   "stoppedRooms": 2,
     *   "roomsBefore": 10,
     *   "roomsAfter": 8,
     *   "idleMinutes": 60
     * }
     * </pre>
     *
     * @return cleanup result with statistics
     */
    @PostMapping("/rooms")
    @Operation(summary = "Manually triggers the idle room cleanup")
    public ResponseEntity<CleanupResultDto> triggerRoomCleanup() {
        long roomsBefore = roomRegistry.roomCount();

        int stopped = cleanupService.triggerCleanup();

        long roomsAfter = roomRegistry.roomCount();

        CleanupResultDto result = new CleanupResultDto(
                "Cleanup completed",
                stopped,
                roomsBefore,
                roomsAfter,
                cleanupService.getIdleMinutes()
        );

        return ResponseEntity.ok(result);
    }

    /**
     * Gets how many rooms are currently eligible for cleanup.
     *
     * @return statistics about idle and recently active rooms
     */
    @GetMapping("/status")
    @Operation(summary = "Gets the status of rooms eligible for cleanup")
    public ResponseEntity<CleanupStatusDto> getCleanupStatus() {
        List<RoomMetrics> allRooms = metricsTracker.all();

        Instant threshold = cleanupService.idleThreshold();

        long idleCount = allRooms.stream()
                .filter(m -> m.isIdleSince(threshold))
                .count();

        CleanupStatusDto status = new CleanupStatusDto(
                allRooms.size(),
                idleCount,
                allRooms.size() - idleCount,
                cleanupService.getIdleMinutes(),
                threshold
        );

        return ResponseEntity.ok(status);
    }

    /**
     * Gets the current cleanup configuration.
     *
     * @return cleanup configuration settings
     */
    @GetMapping("/config")
    @Operation(summary = "Gets the current cleanup configuration")
    public ResponseEntity<CleanupConfigDto> getCleanupConfig() {
        long intervalMs = cleanupService.getCleanupIntervalMs();

        CleanupConfigDto config = new CleanupConfigDto(
                intervalMs,
                intervalMs / 60000.0,
                cleanupService.getIdleMinutes(),
                cleanupService.getLockIdleHours()
        );

        return ResponseEntity.ok(config);
    }
}
