package ch.wordchain.wordchainbackend.service;

import ch.wordchain.wordchainbackend.domain.RoomMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Keeps per-room activity metrics and the aggregate counters of rooms that already ended.
 *
 * <p>Recording an event for an unknown room is a no-op: metrics of a stopped room may still be
 * touched by a late callback and must not resurrect it.
 */
@Service
@Slf4j
public class RoomMetricsTracker {

    private final Map<String, RoomMetrics> metrics = new ConcurrentHashMap<>();

    private final Instant trackingStartedAt = Instant.now();

    private final AtomicLong roomsCreated = new AtomicLong();
    private final AtomicLong roomsCompleted = new AtomicLong();
    private final AtomicLong historicalWords = new AtomicLong();
    private final AtomicLong historicalTimeouts = new AtomicLong();
    private final AtomicLong historicalErrors = new AtomicLong();
    private final AtomicLong completedRoomMillis = new AtomicLong();

    public RoomMetrics register(String roomId, int playerCount) {
        RoomMetrics created = new RoomMetrics(roomId, playerCount);
        RoomMetrics existing = metrics.putIfAbsent(roomId, created);
        if (existing != null) {
            return existing;
        }
        roomsCreated.incrementAndGet();
        return created;
    }

    public void recordWord(String roomId) {
        update(roomId, RoomMetrics::recordWordAccepted);
    }

    public void recordTimeout(String roomId) {
        update(roomId, RoomMetrics::recordTimeout);
    }

    public void recordError(String roomId) {
        update(roomId, RoomMetrics::recordError);
    }

    public void updatePlayerCount(String roomId, int playerCount) {
        update(roomId, m -> m.updatePlayerCount(playerCount));
    }

    public void touch(String roomId) {
        update(roomId, RoomMetrics::touch);
    }

    public Optional<RoomMetrics> find(String roomId) {
        return Optional.ofNullable(metrics.get(roomId));
    }

    /**
     * Removes a room's metrics and folds them into the historical counters.
     *
     * @param roomId room that ended
     * @return the removed metrics, or empty if the room was not tracked
     */
    public Optional<RoomMetrics> remove(String roomId) {
        RoomMetrics removed = metrics.remove(roomId);
        if (removed == null) {
            return Optional.empty();
        }
        roomsCompleted.incrementAndGet();
        historicalWords.addAndGet(removed.getWordsAccepted());
        historicalTimeouts.addAndGet(removed.getTimeouts());
        historicalErrors.addAndGet(removed.getErrors());
        completedRoomMillis.addAndGet(removed.elapsed().toMillis());
        log.debug("Room {} metrics folded: {} words, {} timeouts, {} errors",
                roomId, removed.getWordsAccepted(), removed.getTimeouts(), removed.getErrors());
        return Optional.of(removed);
    }

    /**
     * @param cutoff activity threshold
     * @return ids of rooms without activity since the cutoff
     */
    public List<String> findIdle(Instant cutoff) {
        return metrics.values().stream()
                .filter(m -> m.isIdleSince(cutoff))
                .map(RoomMetrics::getRoomId)
                .toList();
    }

    public List<RoomMetrics> all() {
        return List.copyOf(metrics.values());
    }

    public int trackedRooms() {
        return metrics.size();
    }

    public long getRoomsCreated() {
        return roomsCreated.get();
    }

    public long getRoomsCompleted() {
        return roomsCompleted.get();
    }

    public long totalWords() {
        return historicalWords.get() + metrics.values().stream().mapToLong(RoomMetrics::getWordsAccepted).sum();
    }

    public long totalTimeouts() {
        return historicalTimeouts.get() + metrics.values().stream().mapToLong(RoomMetrics::getTimeouts).sum();
    }

    public long totalErrors() {
        return historicalErrors.get() + metrics.values().stream().mapToLong(RoomMetrics::getErrors).sum();
    }

    public Duration uptime() {
        return Duration.between(trackingStartedAt, Instant.now());
    }

    /**
     * @return average lifetime of completed rooms, zero if none completed yet
     */
    public Duration averageRoomDuration() {
        long completed = roomsCompleted.get();
        if (completed == 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(completedRoomMillis.get() / completed);
    }

    /**
     * @return rooms created per hour of uptime
     */
    public double roomsPerHour() {
        double hours = uptime().toMillis() / 3_600_000.0;
        if (hours <= 0) {
            return 0;
        }
        return roomsCreated.get() / hours;
    }

    private void update(String roomId, Consumer<RoomMetrics> action) {
        RoomMetrics m = metrics.get(roomId);
        if (m != null) {
            action.accept(m);
        }
    }
}
