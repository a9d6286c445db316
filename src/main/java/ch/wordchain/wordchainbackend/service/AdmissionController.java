package ch.wordchain.wordchainbackend.service;

import ch.wordchain.wordchainbackend.domain.enums.LoadLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Decides whether a new room may be created given the current load.
 *
 * <p>Load is the ratio of running rooms to the configured maximum:
 * <ul>
 *   <li>below 40%: {@link LoadLevel#LOW}</li>
 *   <li>below 70%: {@link LoadLevel#MEDIUM}</li>
 *   <li>below 90%: {@link LoadLevel#HIGH}</li>
 *   <li>otherwise: {@link LoadLevel#CRITICAL}</li>
 * </ul>
 *
 * <p>HIGH and CRITICAL checks are recorded in a bounded warning log that status reporting reads.
 */
@Service
@Slf4j
public class AdmissionController {

    @Getter
    private final int maxRooms;

    @Getter
    private final int maxPlayersPerRoom;

    private final int maxWarnings;

    private final Deque<LoadWarning> warnings = new ArrayDeque<>();

    public AdmissionController(@Value("${game.max-rooms:100}") int maxRooms,
                               @Value("${game.max-players-per-room:10}") int maxPlayersPerRoom,
                               @Value("${game.max-warnings:50}") int maxWarnings) {
        if (maxRooms <= 0 || maxPlayersPerRoom <= 0 || maxWarnings <= 0) {
            throw new IllegalArgumentException("Admission limits must be positive");
        }
        this.maxRooms = maxRooms;
        this.maxPlayersPerRoom = maxPlayersPerRoom;
        this.maxWarnings = maxWarnings;
    }

    /**
     * Checks whether another room with the given number of players can be admitted.
     *
     * @param currentRoomCount rooms currently registered
     * @param requestedPlayerCount players the new room starts with
     * @return decision with reason and load level
     */
    public AdmissionDecision canAdmit(int currentRoomCount, int requestedPlayerCount) {
        LoadLevel level = classify(currentRoomCount);
        if (level == LoadLevel.HIGH || level == LoadLevel.CRITICAL) {
            recordWarning(level, currentRoomCount);
        }

        if (currentRoomCount >= maxRooms) {
            return deny("Maximum concurrent rooms limit reached (" + maxRooms + ")", level);
        }
        if (requestedPlayerCount > maxPlayersPerRoom) {
            return deny("Too many players for one room (max: " + maxPlayersPerRoom + ")", level);
        }
        if (level == LoadLevel.CRITICAL) {
            return deny("System resources are critically low", level);
        }
        return AdmissionDecision.allow(level);
    }

    /**
     * @param roomCount rooms currently registered
     * @return load level for that many rooms
     */
    public LoadLevel classify(int roomCount) {
        double ratio = (double) roomCount / maxRooms;
        if (ratio < 0.4) {
            return LoadLevel.LOW;
        }
        if (ratio < 0.7) {
            return LoadLevel.MEDIUM;
        }
        if (ratio < 0.9) {
            return LoadLevel.HIGH;
        }
        return LoadLevel.CRITICAL;
    }

    /**
     * Returns warnings recorded within the given window, oldest first.
     *
     * @param window how far back to look
     * @return recent warnings
     */
    public List<LoadWarning> recentWarnings(Duration window) {
        Instant cutoff = Instant.now().minus(window);
        synchronized (warnings) {
            return warnings.stream()
                    .filter(w -> !w.timestamp().isBefore(cutoff))
                    .toList();
        }
    }

    public int warningCount() {
        synchronized (warnings) {
            return warnings.size();
        }
    }

    /**
     * Records a load warning without an admission request, e.g. from the monitoring loop.
     *
     * @param level observed load level
     * @param roomCount rooms registered at that moment
     */
    public void recordWarning(LoadLevel level, int roomCount) {
        LoadWarning warning = new LoadWarning(Instant.now(), level, roomCount, maxRooms);
        synchronized (warnings) {
            warnings.addLast(warning);
            while (warnings.size() > maxWarnings) {
                warnings.removeFirst();
            }
        }
        log.warn("{} system load: {}/{} rooms", level, roomCount, maxRooms);
    }

    private AdmissionDecision deny(String reason, LoadLevel level) {
        log.warn("Room admission denied: {}", reason);
        return AdmissionDecision.deny(reason, level);
    }

    /**
     * Timestamped load observation.
     */
    public record LoadWarning(Instant timestamp, LoadLevel level, int roomCount, int maxRooms) {
    }
}
