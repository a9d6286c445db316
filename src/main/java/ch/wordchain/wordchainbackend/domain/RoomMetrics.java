package ch.wordchain.wordchainbackend.domain;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks the activity of a single room.
 *
 * <p>Metrics are written by the room's own operations and read concurrently by admission,
 * the idle sweep and status reporting, so counters are atomic and timestamps volatile.
 * {@code lastActivity} drives idle detection: a room whose last activity is older than the
 * configured threshold is eligible for cleanup.
 */
public class RoomMetrics {

    @Getter
    private final String roomId;

    @Getter
    private final Instant startedAt;

    private final AtomicInteger playerCount = new AtomicInteger();
    private final AtomicInteger turnsTaken = new AtomicInteger();
    private final AtomicInteger wordsAccepted = new AtomicInteger();
    private final AtomicInteger timeouts = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();

    /**
     * Timestamp of the last tracked event in this room.
     */
    @Getter
    private volatile Instant lastActivity;

    /**
     * Creates metrics for a freshly created room.
     *
     * @param roomId room identifier
     * @param playerCount players present at creation
     */
    public RoomMetrics(String roomId, int playerCount) {
        this.roomId = roomId;
        this.startedAt = Instant.now();
        this.lastActivity = startedAt;
        this.playerCount.set(playerCount);
    }

    public void recordWordAccepted() {
        wordsAccepted.incrementAndGet();
        turnsTaken.incrementAndGet();
        touch();
    }

    public void recordTimeout() {
        timeouts.incrementAndGet();
        turnsTaken.incrementAndGet();
        touch();
    }

    public void recordError() {
        errors.incrementAndGet();
        touch();
    }

    public void updatePlayerCount(int count) {
        playerCount.set(count);
        touch();
    }

    /**
     * Updates the last activity timestamp to the current time.
     */
    public void touch() {
        this.lastActivity = Instant.now();
    }

    /**
     * Overrides the last activity timestamp, e.g. when restoring or testing idle detection.
     *
     * @param lastActivity new timestamp
     */
    public void touch(Instant lastActivity) {
        this.lastActivity = lastActivity;
    }

    public boolean isIdleSince(Instant cutoff) {
        return lastActivity.isBefore(cutoff);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, Instant.now());
    }

    public int getPlayerCount() {
        return playerCount.get();
    }

    public int getTurnsTaken() {
        return turnsTaken.get();
    }

    public int getWordsAccepted() {
        return wordsAccepted.get();
    }

    public int getTimeouts() {
        return timeouts.get();
    }

    public int getErrors() {
        return errors.get();
    }
}
