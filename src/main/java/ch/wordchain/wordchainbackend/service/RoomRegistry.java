package ch.wordchain.wordchainbackend.service;

import ch.wordchain.wordchainbackend.domain.GameConfiguration;
import ch.wordchain.wordchainbackend.domain.GameState;
import ch.wordchain.wordchainbackend.domain.Player;
import ch.wordchain.wordchainbackend.domain.StartingLetters;
import ch.wordchain.wordchainbackend.exception.RoomNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the mapping from room id to its {@link GameState}.
 *
 * <p>There is at most one state per room id. Lifecycle transitions performed here
 * (create, promote, stop) are expected to run under the room's gate in
 * {@link RoomIsolationManager}; the map itself is only touched through atomic operations.
 *
 * <p>Capacity is counted in slots: every registered room occupies one from creation until
 * {@link #stop(String)}, and a join that is about to create a room reserves one ahead of time
 * with {@link #reserveSlot()}. Admission decides on the slot count, so concurrent joins of
 * different new rooms cannot all pass the same check.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoomRegistry {

    private static final String WAITING_SUFFIX = "#waiting";

    private final TimerEngine timerEngine;
    private final RoomMetricsTracker metricsTracker;

    private final Map<String, GameState> rooms = new ConcurrentHashMap<>();
    private final AtomicInteger occupiedSlots = new AtomicInteger();
    private final Random random = new Random();

    /**
     * Key of the grace-window countdown of a waiting room. Turn countdowns use the room id itself.
     *
     * @param roomId room identifier
     * @return timer key for the waiting countdown
     */
    public static String waitingTimerKey(String roomId) {
        return roomId + WAITING_SUFFIX;
    }

    public GameState createWaiting(String roomId, Player firstPlayer, GameConfiguration config) {
        return createWaiting(roomId, firstPlayer, config, StartingLetters.random(random));
    }

    /**
     * Registers a new waiting room containing its first player.
     *
     * @param roomId room identifier
     * @param firstPlayer player who opened the room
     * @param config configuration for the room
     * @param startingLetter letter the first word has to start with
     * @return the new state
     * @throws IllegalStateException if a room with that id already exists
     */
    public GameState createWaiting(String roomId, Player firstPlayer, GameConfiguration config, char startingLetter) {
        return register(roomId, firstPlayer, config, startingLetter, false);
    }

    /**
     * Registers a new waiting room that takes over a slot reserved with {@link #reserveSlot()}.
     * The reservation is consumed on success and released if the room already exists.
     *
     * @param roomId room identifier
     * @param firstPlayer player who opened the room
     * @param config configuration for the room
     * @return the new state
     * @throws IllegalStateException if a room with that id already exists
     */
    public GameState createReserved(String roomId, Player firstPlayer, GameConfiguration config) {
        return register(roomId, firstPlayer, config, StartingLetters.random(random), true);
    }

    /**
     * Claims a room slot ahead of creating a room. The caller must either hand it to
     * {@link #createReserved} or give it back with {@link #releaseSlot()}.
     *
     * @return slots occupied before this reservation
     */
    public int reserveSlot() {
        return occupiedSlots.getAndIncrement();
    }

    public void releaseSlot() {
        occupiedSlots.decrementAndGet();
    }

    /**
     * @return registered rooms plus outstanding reservations
     */
    public int occupiedSlots() {
        return occupiedSlots.get();
    }

    private GameState register(String roomId, Player firstPlayer, GameConfiguration config,
                               char startingLetter, boolean reserved) {
        GameState state = new GameState(roomId, config, startingLetter);
        state.addPlayer(firstPlayer);
        if (rooms.putIfAbsent(roomId, state) != null) {
            if (reserved) {
                releaseSlot();
            }
            throw new IllegalStateException("Room " + roomId + " already exists");
        }
        if (!reserved) {
            occupiedSlots.incrementAndGet();
        }
        metricsTracker.register(roomId, state.getPlayers().size());
        log.info("Room {} created by {} (starting letter {})", roomId, firstPlayer, state.getCurrentLetter());
        return state;
    }

    /**
     * Moves a waiting room into play.
     *
     * @param roomId room identifier
     * @return the activated state
     * @throws RoomNotFoundException if the room is unknown
     * @throws IllegalStateException if the room is not waiting or has too few players
     */
    public GameState promoteToActive(String roomId) {
        GameState state = get(roomId);
        if (!state.isWaiting()) {
            throw new IllegalStateException("Room " + roomId + " is not waiting (" + state.getStatus() + ")");
        }
        int required = state.getConfig().getMinPlayersToStart();
        if (state.getPlayers().size() < required) {
            throw new IllegalStateException(
                    "Room " + roomId + " needs at least " + required + " players, has " + state.getPlayers().size());
        }
        timerEngine.cancel(waitingTimerKey(roomId));
        state.activate();
        metricsTracker.updatePlayerCount(roomId, state.getPlayers().size());
        log.info("Room {} started with {} players", roomId, state.getPlayers().size());
        return state;
    }

    /**
     * Ends a room and releases everything bound to it. Safe to call repeatedly.
     *
     * @param roomId room identifier
     * @return {@code true} if a room was removed by this call
     */
    public boolean stop(String roomId) {
        GameState state = rooms.remove(roomId);
        if (state == null) {
            return false;
        }
        releaseSlot();
        state.terminate();
        timerEngine.cancel(roomId);
        timerEngine.cancel(waitingTimerKey(roomId));
        metricsTracker.remove(roomId);
        log.info("Room {} stopped", roomId);
        return true;
    }

    public Optional<GameState> find(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public GameState get(String roomId) {
        return find(roomId).orElseThrow(() -> new RoomNotFoundException(roomId));
    }

    public int roomCount() {
        return rooms.size();
    }

    public int activeRoomCount() {
        return (int) rooms.values().stream().filter(GameState::isActive).count();
    }

    public int totalPlayers() {
        return rooms.values().stream().mapToInt(s -> s.getPlayers().size()).sum();
    }

    public List<GameState> rooms() {
        return List.copyOf(rooms.values());
    }

    /**
     * @param cutoff activity threshold
     * @return ids of registered rooms without activity since the cutoff
     */
    public List<String> findIdleRooms(Instant cutoff) {
        return metricsTracker.findIdle(cutoff).stream()
                .filter(rooms::containsKey)
                .toList();
    }
}
