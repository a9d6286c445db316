package ch.wordchain.wordchainbackend.service;

import ch.wordchain.wordchainbackend.domain.enums.GameEndReason;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Service responsible for periodic cleanup of abandoned rooms.
 *
 * <p>This service runs a scheduled sweep that stops rooms without any activity for a
 * configurable period and releases room gates that were not used for a much longer period.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code game.cleanup.interval-ms}: How often to run cleanup (default: 5 minutes)</li>
 *   <li>{@code game.cleanup.idle-minutes}: Inactivity threshold for stopping a room (default: 60 minutes)</li>
 *   <li>{@code game.cleanup.lock-idle-hours}: Inactivity threshold for reclaiming a room gate (default: 24 hours)</li>
 * </ul>
 *
 * <p>The sweep also runs on demand when admission is denied, so that capacity held by
 * abandoned rooms can be reused right away.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Getter
public class RoomCleanupService {

    private final RoomRegistry roomRegistry;
    private final RoomIsolationManager isolationManager;
    private final RoomMetricsTracker metricsTracker;
    private final TurnScheduler turnScheduler;

    /**
     * How often the cleanup task runs (in milliseconds).
     * Configurable via {@code game.cleanup.interval-ms}.
     */
    @Value("${game.cleanup.interval-ms:300000}")
    private long cleanupIntervalMs;

    /**
     * Rooms without activity for this many minutes are stopped.
     */
    @Value("${game.cleanup.idle-minutes:60}")
    private int idleMinutes;

    /**
     * Room gates unused for this many hours are reclaimed.
     */
    @Value("${game.cleanup.lock-idle-hours:24}")
    private int lockIdleHours;

    /**
     * Scheduled task that stops idle rooms.
     *
     * <p>Logging:
     * <ul>
     *   <li>INFO level: Reports number of rooms stopped (only if > 0)</li>
     *   <li>DEBUG level: Logs cleanup runs even with zero rooms stopped</li>
     * </ul>
     */
    @Scheduled(fixedRateString = "${game.cleanup.interval-ms:300000}")
    public void cleanupIdleRooms() {
        sweep();
    }

    /**
     * Stops idle rooms and reclaims unused room gates.
     *
     * <p>Each room is re-checked under its own gate before it is stopped, so a room that became
     * active again in the meantime survives. A failure while stopping one room is logged and
     * does not prevent the others from being cleaned up.
     *
     * @return number of rooms stopped
     */
    public int sweep() {
        Instant threshold = idleThreshold();
        List<String> idleRoomIds = roomRegistry.findIdleRooms(threshold);

        log.debug("Starting room cleanup. {} candidate(s) idle since {} (threshold: {} minutes)",
                idleRoomIds.size(), threshold, idleMinutes);

        int stopped = 0;
        for (String roomId : idleRoomIds) {
            try {
                if (stopIfStillIdle(roomId, threshold)) {
                    stopped++;
                }
            } catch (RuntimeException e) {
                log.error("Cleanup of room {} failed", roomId, e);
            }
        }

        isolationManager.reclaimIdle(Instant.now().minusSeconds(lockIdleHours * 3600L));

        if (stopped > 0) {
            log.info("Cleaned up {} idle room(s) (inactive for more than {} minutes)", stopped, idleMinutes);
        } else {
            log.debug("No idle rooms to clean up");
        }
        return stopped;
    }

    /**
     * Manually triggers the cleanup process.
     *
     * <p>This method can be called outside of the scheduled execution,
     * for example by an admin endpoint or in tests.
     *
     * @return number of rooms stopped
     */
    public int triggerCleanup() {
        return sweep();
    }

    public Instant idleThreshold() {
        return Instant.now().minusSeconds(idleMinutes * 60L);
    }

    private boolean stopIfStillIdle(String roomId, Instant threshold) {
        return isolationManager.withRoomLock(roomId, () -> {
            boolean stillIdle = metricsTracker.find(roomId)
                    .map(m -> m.isIdleSince(threshold))
                    .orElse(false);
            if (!stillIdle) {
                return false;
            }
            return roomRegistry.find(roomId)
                    .map(state -> turnScheduler.endGame(state, GameEndReason.IDLE_TIMEOUT))
                    .orElse(false);
        });
    }
}
