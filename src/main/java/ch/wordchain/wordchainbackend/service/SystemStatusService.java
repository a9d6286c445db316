package ch.wordchain.wordchainbackend.service;

import ch.wordchain.wordchainbackend.domain.enums.LoadLevel;
import ch.wordchain.wordchainbackend.service.dictionary.DictionaryService;
import ch.wordchain.wordchainbackend.web.api.dto.RoomMetricsDto;
import ch.wordchain.wordchainbackend.web.api.dto.SystemStatusDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Builds read-only status snapshots and periodically logs the system load.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SystemStatusService {

    private static final Duration WARNING_WINDOW = Duration.ofHours(1);

    private final RoomRegistry roomRegistry;
    private final AdmissionController admissionController;
    private final RoomMetricsTracker metricsTracker;
    private final RoomIsolationManager isolationManager;
    private final TimerEngine timerEngine;
    private final DictionaryService dictionaryService;

    public SystemStatusDto snapshot() {
        int roomCount = roomRegistry.roomCount();
        List<RoomMetricsDto> rooms = metricsTracker.all().stream()
                .map(RoomMetricsDto::from)
                .sorted(Comparator.comparing(RoomMetricsDto::startedAt))
                .toList();

        return new SystemStatusDto(
                Instant.now(),
                roomCount,
                roomRegistry.activeRoomCount(),
                admissionController.getMaxRooms(),
                admissionController.classify(roomCount),
                roomRegistry.totalPlayers(),
                timerEngine.activeCount(),
                isolationManager.gateCount(),
                dictionaryService.isAvailable(),
                metricsTracker.uptime().toSeconds(),
                metricsTracker.getRoomsCreated(),
                metricsTracker.getRoomsCompleted(),
                metricsTracker.totalWords(),
                metricsTracker.totalTimeouts(),
                metricsTracker.totalErrors(),
                Math.round(metricsTracker.roomsPerHour() * 100.0) / 100.0,
                metricsTracker.averageRoomDuration().toSeconds(),
                admissionController.recentWarnings(WARNING_WINDOW).size(),
                rooms
        );
    }

    /**
     * Logs the current load. HIGH and CRITICAL load is also recorded as a warning.
     */
    @Scheduled(fixedRateString = "${game.monitor.interval-ms:600000}",
            initialDelayString = "${game.monitor.interval-ms:600000}")
    public void logStatus() {
        int roomCount = roomRegistry.roomCount();
        LoadLevel level = admissionController.classify(roomCount);

        log.info("Status: {} room(s) ({} active), {} player(s), {} timer(s), load {}",
                roomCount, roomRegistry.activeRoomCount(), roomRegistry.totalPlayers(),
                timerEngine.activeCount(), level);

        if (level == LoadLevel.HIGH || level == LoadLevel.CRITICAL) {
            admissionController.recordWarning(level, roomCount);
        }
        if (!dictionaryService.isAvailable()) {
            log.warn("Dictionary is currently unavailable");
        }
    }
}
