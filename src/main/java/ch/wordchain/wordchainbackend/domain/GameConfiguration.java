package ch.wordchain.wordchainbackend.domain;

import ch.wordchain.wordchainbackend.domain.enums.TimeoutPolicy;
import lombok.Getter;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * Configuration for a game room.
 *
 * <p>Defines the turn timing, the word length bounds and the room size limits. A room keeps
 * the configuration it was created with, so the instance is immutable.
 */
@Getter
public class GameConfiguration {

    /**
     * Seconds a player has to submit a word.
     */
    private final int turnTimeoutSeconds;

    /**
     * Required length of the first word. Grows during the game.
     */
    private final int minWordLength;

    /**
     * Upper bound for any submitted word.
     */
    private final int maxWordLength;

    private final int maxPlayersPerRoom;

    /**
     * Remaining-seconds thresholds for turn warnings, sorted descending.
     */
    private final List<Integer> warningOffsetsSeconds;

    /**
     * Players needed before a waiting room may start.
     */
    private final int minPlayersToStart;

    /**
     * Length of the grace window in which other players may join a waiting room.
     */
    private final int waitingPeriodSeconds;

    /**
     * Remaining-seconds thresholds for the join countdown, sorted descending.
     */
    private final List<Integer> waitingWarningOffsetsSeconds;

    private final TimeoutPolicy timeoutPolicy;

    public GameConfiguration(int turnTimeoutSeconds,
                             int minWordLength,
                             int maxWordLength,
                             int maxPlayersPerRoom,
                             List<Integer> warningOffsetsSeconds,
                             int minPlayersToStart,
                             int waitingPeriodSeconds,
                             List<Integer> waitingWarningOffsetsSeconds,
                             TimeoutPolicy timeoutPolicy) {
        if (turnTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("Turn timeout must be positive");
        }
        if (minWordLength < 1 || minWordLength > maxWordLength) {
            throw new IllegalArgumentException(
                    "Invalid word length bounds: min=" + minWordLength + ", max=" + maxWordLength);
        }
        if (minPlayersToStart < 2 || maxPlayersPerRoom < minPlayersToStart) {
            throw new IllegalArgumentException(
                    "Invalid player bounds: minToStart=" + minPlayersToStart + ", maxPerRoom=" + maxPlayersPerRoom);
        }
        if (waitingPeriodSeconds < 0) {
            throw new IllegalArgumentException("Waiting period must not be negative");
        }
        if (timeoutPolicy == null) {
            throw new IllegalArgumentException("Timeout policy is required");
        }
        this.turnTimeoutSeconds = turnTimeoutSeconds;
        this.minWordLength = minWordLength;
        this.maxWordLength = maxWordLength;
        this.maxPlayersPerRoom = maxPlayersPerRoom;
        this.warningOffsetsSeconds = normalizeOffsets(warningOffsetsSeconds);
        this.minPlayersToStart = minPlayersToStart;
        this.waitingPeriodSeconds = waitingPeriodSeconds;
        this.waitingWarningOffsetsSeconds = normalizeOffsets(waitingWarningOffsetsSeconds);
        this.timeoutPolicy = timeoutPolicy;
    }

    /**
     * Returns the default game configuration used by the application.
     *
     * @return default configuration (30s turns, words of at least 2 letters, up to 10 players)
     */
    public static GameConfiguration defaultConfig() {
        return new GameConfiguration(
                30,
                2,
                20,
                10,
                List.of(15, 10, 5),
                2,
                60,
                List.of(30, 20, 10),
                TimeoutPolicy.ELIMINATE
        );
    }

    public Duration getTurnTimeout() {
        return Duration.ofSeconds(turnTimeoutSeconds);
    }

    public Duration getWaitingPeriod() {
        return Duration.ofSeconds(waitingPeriodSeconds);
    }

    public List<Duration> getWarningOffsets() {
        return warningOffsetsSeconds.stream().map(Duration::ofSeconds).toList();
    }

    public List<Duration> getWaitingWarningOffsets() {
        return waitingWarningOffsetsSeconds.stream().map(Duration::ofSeconds).toList();
    }

    private static List<Integer> normalizeOffsets(List<Integer> offsets) {
        if (offsets == null) {
            return List.of();
        }
        if (offsets.stream().anyMatch(o -> o == null || o < 0)) {
            throw new IllegalArgumentException("Warning offsets must not be negative: " + offsets);
        }
        return offsets.stream()
                .distinct()
                .sorted(Comparator.reverseOrder())
                .toList();
    }
}
