package ch.wordchain.wordchainbackend.service;

import ch.wordchain.wordchainbackend.domain.GameConfiguration;
import ch.wordchain.wordchainbackend.domain.GameState;
import ch.wordchain.wordchainbackend.domain.Player;
import ch.wordchain.wordchainbackend.domain.enums.GameEndReason;
import ch.wordchain.wordchainbackend.domain.enums.SubmissionResult;
import ch.wordchain.wordchainbackend.exception.AdmissionDeniedException;
import ch.wordchain.wordchainbackend.exception.RoomNotFoundException;
import ch.wordchain.wordchainbackend.web.api.dto.GameEventDto;
import ch.wordchain.wordchainbackend.web.api.dto.JoinRoomResponseDto;
import ch.wordchain.wordchainbackend.web.api.dto.PlayerDto;
import ch.wordchain.wordchainbackend.web.api.dto.RoomStateDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Application service for room and game lifecycle operations.
 *
 * <p>Entry point for all inbound actions (REST and STOMP). Every operation that reads or
 * changes a room runs under that room's gate in {@link RoomIsolationManager}, so a room sees
 * its submissions, timeouts and lifecycle changes one at a time while other rooms proceed in
 * parallel.
 *
 * <p>Lifecycle of a room:
 * <ul>
 *   <li>The first join creates a WAITING room (subject to admission) and starts the join countdown.</li>
 *   <li>The game starts on {@link #startGame(String)} or when the countdown ends with enough players.</li>
 *   <li>The game ends when one active player is left, when it is stopped, or when the room idles.</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameService {

    private final RoomRegistry roomRegistry;
    private final RoomIsolationManager isolationManager;
    private final AdmissionController admissionController;
    private final WordProcessor wordProcessor;
    private final TurnScheduler turnScheduler;
    private final TimerEngine timerEngine;
    private final RoomMetricsTracker metricsTracker;
    private final RoomCleanupService cleanupService;
    private final GameEventPublisher eventPublisher;
    private final GameConfiguration gameConfiguration;

    // ------------------------------------------------------------------------------------
    // Joining and waiting phase
    // ------------------------------------------------------------------------------------

    /**
     * Adds a player to a room, creating the room if it does not exist yet.
     *
     * @param roomId room identifier
     * @param playerId transport user id
     * @param displayName display name of the player
     * @return join result
     * @throws AdmissionDeniedException if a new room would exceed the system's capacity
     * @throws IllegalStateException if the game in the room already runs or the room is full
     */
    public JoinRoomResponseDto joinRoom(String roomId, long playerId, String displayName) {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Display name is required");
        }
        Player player = new Player(playerId, displayName.trim());

        while (true) {
            boolean reserved = false;
            if (roomRegistry.find(roomId).isEmpty()) {
                // admission runs outside the room gate: the retry sweep locks other rooms
                admit();
                reserved = true;
            }
            JoinRoomResponseDto response = joinUnderGate(roomId, player, reserved);
            if (response != null) {
                return response;
            }
            log.debug("Room {} was removed before {} could join, retrying", roomId, player);
        }
    }

    /**
     * @return the join result, or {@code null} if the room vanished and no slot was reserved
     */
    private JoinRoomResponseDto joinUnderGate(String roomId, Player player, boolean reserved) {
        return isolationManager.withRoomLock(roomId, () -> {
            Optional<GameState> existing = roomRegistry.find(roomId);
            if (existing.isPresent()) {
                if (reserved) {
                    roomRegistry.releaseSlot();
                }
                return joinExisting(existing.get(), player);
            }
            if (!reserved) {
                return null;
            }

            GameState state = roomRegistry.createReserved(roomId, player, gameConfiguration);
            startWaitingCountdown(state);
            eventPublisher.publish(GameEventDto.playerJoined(state, player));
            return toJoinResponse(state, player, true);
        });
    }

    /**
     * Starts the game in a waiting room right away. If players paused while waiting leave at
     * most one active player, the game ends at once with that player as winner.
     *
     * @param roomId room identifier
     * @return room state after the start
     * @throws RoomNotFoundException if the room does not exist
     * @throws IllegalStateException if the room is not waiting or has too few players
     */
    public RoomStateDto startGame(String roomId) {
        return isolationManager.withRoomLock(roomId, () -> {
            GameState state = roomRegistry.get(roomId);
            beginGame(state);
            return toRoomState(state);
        });
    }

    // ------------------------------------------------------------------------------------
    // Playing
    // ------------------------------------------------------------------------------------

    /**
     * Handles a word submitted by a player.
     *
     * <p>On acceptance the running turn countdown is cancelled, the state advances and the next
     * player's countdown starts. Rejections never change the room.
     *
     * @param roomId room identifier
     * @param playerId submitting player
     * @param word submitted text
     * @return outcome of the submission
     */
    public SubmissionOutcome submitWord(String roomId, long playerId, String word) {
        return isolationManager.withRoomLock(roomId, () -> {
            GameState state = roomRegistry.find(roomId).orElse(null);
            SubmissionOutcome outcome = wordProcessor.submit(state, playerId, word);
            if (state == null) {
                return outcome;
            }

            if (outcome.accepted()) {
                Player player = state.currentPlayer().orElseThrow();
                turnScheduler.cancelTurn(roomId);
                wordProcessor.computeNextState(outcome.normalizedWord(), state);
                metricsTracker.recordWord(roomId);
                eventPublisher.publish(GameEventDto.wordAccepted(state, player, outcome.normalizedWord()));
                log.info("Room {}: {} played '{}'", roomId, player, outcome.normalizedWord());
                turnScheduler.beginTurn(state);
                return outcome;
            }

            if (outcome.result() == SubmissionResult.VALIDATION_ERROR) {
                metricsTracker.recordError(roomId);
            } else {
                metricsTracker.touch(roomId);
            }
            if (outcome.message() != null) {
                eventPublisher.publish(GameEventDto.wordRejected(state, playerId, outcome.result(), outcome.message()));
            }
            return outcome;
        });
    }

    /**
     * Removes a player from a room. Leaving during the game hands the turn on if the player
     * held it and ends the game if only one active player is left.
     *
     * @param roomId room identifier
     * @param playerId leaving player
     * @throws RoomNotFoundException if the room does not exist
     * @throws IllegalArgumentException if the player is not in the room
     */
    public void leaveRoom(String roomId, long playerId) {
        isolationManager.withRoomLock(roomId, () -> {
            GameState state = roomRegistry.get(roomId);
            Player player = state.findPlayer(playerId)
                    .orElseThrow(() -> new IllegalArgumentException("Player " + playerId + " is not in room " + roomId));
            boolean wasCurrent = isCurrent(state, playerId);

            state.removePlayer(playerId);
            metricsTracker.updatePlayerCount(roomId, state.getPlayers().size());
            eventPublisher.publish(GameEventDto.playerLeft(state, player));
            log.info("Player {} left room {}", player, roomId);

            if (state.isWaiting()) {
                if (state.getPlayers().isEmpty()) {
                    turnScheduler.endGame(state, GameEndReason.NOT_ENOUGH_PLAYERS);
                }
                return;
            }
            afterTurnOrderChange(state, wasCurrent);
        });
    }

    /**
     * Marks a player as taking part in the turn order or not. A deactivated player keeps the
     * seat but is skipped.
     *
     * @param roomId room identifier
     * @param playerId player to update
     * @param active new flag value
     * @return room state after the change
     * @throws RoomNotFoundException if the room does not exist
     * @throws IllegalArgumentException if the player is not in the room
     */
    public RoomStateDto setPlayerActive(String roomId, long playerId, boolean active) {
        return isolationManager.withRoomLock(roomId, () -> {
            GameState state = roomRegistry.get(roomId);
            boolean wasCurrent = isCurrent(state, playerId);
            if (!state.setPlayerActive(playerId, active)) {
                throw new IllegalArgumentException("Player " + playerId + " is not in room " + roomId);
            }
            metricsTracker.touch(roomId);
            log.info("Player {} in room {} is now {}", playerId, roomId, active ? "active" : "inactive");

            if (state.isActive()) {
                afterTurnOrderChange(state, wasCurrent && !active);
            }
            return toRoomState(state);
        });
    }

    // ------------------------------------------------------------------------------------
    // Stopping and queries
    // ------------------------------------------------------------------------------------

    /**
     * Stops the game in a room and removes the room.
     *
     * @param roomId room identifier
     * @return {@code true} if a room was stopped, {@code false} if there was none
     */
    public boolean stopGame(String roomId) {
        return isolationManager.withRoomLock(roomId, () -> roomRegistry.find(roomId)
                .map(state -> turnScheduler.endGame(state, GameEndReason.STOPPED))
                .orElse(false));
    }

    /**
     * @param roomId room identifier
     * @return public view of the room
     * @throws RoomNotFoundException if the room does not exist
     */
    public RoomStateDto getRoomState(String roomId) {
        return isolationManager.withRoomLock(roomId, () -> toRoomState(roomRegistry.get(roomId)));
    }

    // ------------------------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------------------------

    /**
     * Admits a new room and leaves a reserved slot for it in the registry.
     */
    private void admit() {
        AdmissionDecision decision = reserveAndDecide();
        if (decision.allowed()) {
            return;
        }
        int stopped = cleanupService.sweep();
        if (stopped > 0) {
            log.info("Admission retry after cleanup freed {} room(s)", stopped);
            decision = reserveAndDecide();
        }
        if (!decision.allowed()) {
            throw new AdmissionDeniedException(decision.reason(), decision.loadLevel());
        }
    }

    private AdmissionDecision reserveAndDecide() {
        int occupied = roomRegistry.reserveSlot();
        AdmissionDecision decision = admissionController.canAdmit(occupied, 1);
        if (!decision.allowed()) {
            roomRegistry.releaseSlot();
        }
        return decision;
    }

    private JoinRoomResponseDto joinExisting(GameState state, Player player) {
        if (state.isMember(player.getId())) {
            return toJoinResponse(state, player, false);
        }
        if (!state.isWaiting()) {
            throw new IllegalStateException("Game in room " + state.getRoomId() + " is already running");
        }
        if (!state.addPlayer(player)) {
            throw new IllegalStateException("Room " + state.getRoomId() + " is full");
        }
        metricsTracker.updatePlayerCount(state.getRoomId(), state.getPlayers().size());
        eventPublisher.publish(GameEventDto.playerJoined(state, player));
        log.info("Player {} joined room {} ({} players)", player, state.getRoomId(), state.getPlayers().size());
        return toJoinResponse(state, player, false);
    }

    private void startWaitingCountdown(GameState state) {
        String roomId = state.getRoomId();
        GameConfiguration config = state.getConfig();
        timerEngine.start(
                RoomRegistry.waitingTimerKey(roomId),
                config.getWaitingPeriod(),
                key -> onWaitingExpired(roomId),
                (key, remaining) -> onWaitingWarning(roomId, remaining),
                config.getWaitingWarningOffsets()
        );
    }

    void onWaitingWarning(String roomId, Duration remaining) {
        isolationManager.withRoomLock(roomId, () -> roomRegistry.find(roomId)
                .filter(GameState::isWaiting)
                .ifPresent(state -> eventPublisher.publish(
                        GameEventDto.waitingCountdown(state, (remaining.toMillis() + 999) / 1000))));
    }

    void onWaitingExpired(String roomId) {
        isolationManager.withRoomLock(roomId, () -> {
            Optional<GameState> found = roomRegistry.find(roomId).filter(GameState::isWaiting);
            if (found.isEmpty()) {
                return;
            }
            GameState state = found.get();
            if (state.getPlayers().size() >= state.getConfig().getMinPlayersToStart()) {
                beginGame(state);
            } else {
                log.info("Room {} did not get enough players in time", roomId);
                turnScheduler.endGame(state, GameEndReason.NOT_ENOUGH_PLAYERS);
            }
        });
    }

    private void beginGame(GameState state) {
        roomRegistry.promoteToActive(state.getRoomId());
        if (state.shouldTerminate()) {
            // players paused while waiting leave at most one contender
            log.info("Room {} has {} active player(s) at start, ending game",
                    state.getRoomId(), state.activePlayers().size());
            turnScheduler.endGame(state, GameEndReason.LAST_PLAYER_STANDING);
            return;
        }
        eventPublisher.publish(GameEventDto.gameStarted(state));
        turnScheduler.beginTurn(state);
    }

    private void afterTurnOrderChange(GameState state, boolean currentPlayerGone) {
        if (state.shouldTerminate()) {
            turnScheduler.endGame(state, GameEndReason.LAST_PLAYER_STANDING);
        } else if (currentPlayerGone) {
            state.skipInactive();
            turnScheduler.beginTurn(state);
        }
    }

    private static boolean isCurrent(GameState state, long playerId) {
        return state.isActive() && state.currentPlayer().map(p -> p.getId() == playerId).orElse(false);
    }

    private JoinRoomResponseDto toJoinResponse(GameState state, Player player, boolean created) {
        return new JoinRoomResponseDto(
                state.getRoomId(),
                player.getId(),
                player.getDisplayName(),
                state.getStatus(),
                state.getPlayers().size(),
                created
        );
    }

    private RoomStateDto toRoomState(GameState state) {
        Optional<Player> current = state.isActive() ? state.currentPlayer() : Optional.empty();
        List<PlayerDto> players = state.turnOrder().stream().map(PlayerDto::from).toList();
        Long remaining = state.isActive()
                ? state.remainingTurnTime().map(Duration::toSeconds).orElse(null)
                : null;

        return new RoomStateDto(
                state.getRoomId(),
                state.getStatus(),
                players,
                current.map(Player::getId).orElse(null),
                current.map(Player::getDisplayName).orElse(null),
                String.valueOf(state.getCurrentLetter()),
                state.getRequiredLength(),
                List.copyOf(state.getUsedWords()),
                remaining,
                state.getRoundsCompleted(),
                wordProcessor.hint(state),
                wordProcessor.difficulty(state)
        );
    }
}
