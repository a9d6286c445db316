package ch.wordchain.wordchainbackend.service;

import ch.wordchain.wordchainbackend.domain.GameConfiguration;
import ch.wordchain.wordchainbackend.domain.GameState;
import ch.wordchain.wordchainbackend.domain.Player;
import ch.wordchain.wordchainbackend.domain.enums.GameEndReason;
import ch.wordchain.wordchainbackend.web.api.dto.GameEventDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Binds the {@link TimerEngine} to turn taking.
 *
 * <p>Every turn gets a countdown keyed by the room id. Warning and timeout callbacks run on
 * scheduler threads, so they first acquire the room's gate and then check that the turn they
 * belong to is still the current one (via the state's turn token). A callback that lost the race
 * against a submission, a stop or a newer turn does nothing.
 *
 * <p>On timeout the room's {@link ch.wordchain.wordchainbackend.domain.enums.TimeoutPolicy}
 * applies: ELIMINATE removes the player, SKIP only passes the turn on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnScheduler {

    private final TimerEngine timerEngine;
    private final RoomRegistry roomRegistry;
    private final RoomIsolationManager isolationManager;
    private final RoomMetricsTracker metricsTracker;
    private final GameEventPublisher eventPublisher;

    /**
     * Starts the countdown for the current player's turn. Must be called under the room's gate.
     *
     * @param state active room state
     */
    public void beginTurn(GameState state) {
        if (!state.isActive()) {
            return;
        }
        Optional<Player> current = state.currentPlayer();
        if (current.isEmpty()) {
            log.warn("Room {} has no current player, ending game", state.getRoomId());
            endGame(state, GameEndReason.LAST_PLAYER_STANDING);
            return;
        }

        String roomId = state.getRoomId();
        GameConfiguration config = state.getConfig();
        long token = state.nextTurnToken();
        state.anchorTurn();

        timerEngine.start(
                roomId,
                config.getTurnTimeout(),
                key -> onTimeout(roomId, token),
                (key, remaining) -> onWarning(roomId, token, remaining),
                config.getWarningOffsets()
        );
        metricsTracker.touch(roomId);
        eventPublisher.publish(GameEventDto.turnStarted(state, current.get()));
        log.debug("Room {} turn {} started for {}", roomId, token, current.get());
    }

    /**
     * Stops the running turn countdown of a room.
     *
     * @param roomId room identifier
     * @return {@code true} if a running countdown was stopped
     */
    public boolean cancelTurn(String roomId) {
        return timerEngine.cancel(roomId);
    }

    /**
     * Terminates a game, announces the result and removes the room. Only a game that ends with
     * exactly one active player left has a winner. Must be called under the room's gate.
     *
     * @param state room to end
     * @param reason why the game ends
     * @return {@code true} if the room was still registered and got removed
     */
    public boolean endGame(GameState state, GameEndReason reason) {
        List<Player> remaining = state.activePlayers();
        Player winner = reason == GameEndReason.LAST_PLAYER_STANDING && remaining.size() == 1
                ? remaining.get(0)
                : null;

        state.terminate();
        eventPublisher.publish(GameEventDto.gameEnded(state, winner, reason));
        boolean removed = roomRegistry.stop(state.getRoomId());

        log.info("Game in room {} ended ({}), winner: {}", state.getRoomId(), reason,
                winner != null ? winner : "none");
        return removed;
    }

    void onWarning(String roomId, long token, Duration remaining) {
        isolationManager.withRoomLock(roomId, () -> {
            Optional<GameState> state = currentTurnState(roomId, token);
            if (state.isEmpty()) {
                return;
            }
            state.get().currentPlayer().ifPresent(player ->
                    eventPublisher.publish(GameEventDto.turnWarning(state.get(), player, roundUpSeconds(remaining))));
        });
    }

    void onTimeout(String roomId, long token) {
        isolationManager.withRoomLock(roomId, () -> {
            Optional<GameState> found = currentTurnState(roomId, token);
            if (found.isEmpty()) {
                log.debug("Ignoring stale timeout for room {} (turn {})", roomId, token);
                return;
            }
            GameState state = found.get();
            metricsTracker.recordTimeout(roomId);

            Optional<Player> timedOut = state.currentPlayer();
            if (timedOut.isEmpty()) {
                endGame(state, GameEndReason.LAST_PLAYER_STANDING);
                return;
            }

            switch (state.getConfig().getTimeoutPolicy()) {
                case ELIMINATE -> eliminate(state, timedOut.get());
                case SKIP -> skip(state, timedOut.get());
            }
        });
    }

    private void eliminate(GameState state, Player player) {
        state.removePlayer(player.getId());
        if (state.activePlayers().size() > 1) {
            state.skipInactive();
        }
        metricsTracker.updatePlayerCount(state.getRoomId(), state.getPlayers().size());
        eventPublisher.publish(GameEventDto.playerEliminated(state, player));
        log.info("Player {} eliminated from room {} (timeout)", player, state.getRoomId());

        if (state.shouldTerminate()) {
            endGame(state, GameEndReason.LAST_PLAYER_STANDING);
        } else {
            beginTurn(state);
        }
    }

    private void skip(GameState state, Player player) {
        state.advanceTurn();
        state.skipInactive();
        eventPublisher.publish(GameEventDto.playerSkipped(state, player));
        log.info("Player {} skipped in room {} (timeout)", player, state.getRoomId());
        beginTurn(state);
    }

    private Optional<GameState> currentTurnState(String roomId, long token) {
        return roomRegistry.find(roomId)
                .filter(GameState::isActive)
                .filter(s -> s.getTurnToken() == token);
    }

    private static long roundUpSeconds(Duration remaining) {
        return (remaining.toMillis() + 999) / 1000;
    }
}
