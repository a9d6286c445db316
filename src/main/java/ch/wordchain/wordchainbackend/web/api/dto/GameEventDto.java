package ch.wordchain.wordchainbackend.web.api.dto;

import ch.wordchain.wordchainbackend.domain.GameState;
import ch.wordchain.wordchainbackend.domain.Player;
import ch.wordchain.wordchainbackend.domain.enums.GameEndReason;
import ch.wordchain.wordchainbackend.domain.enums.GameEventType;
import ch.wordchain.wordchainbackend.domain.enums.GameStatus;
import ch.wordchain.wordchainbackend.domain.enums.SubmissionResult;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public record GameEventDto(
        GameEventType type,
        String roomId,
        GameStatus roomStatus,
        Instant timeStamp,
        Map<String, Object> payload
) {
    public static GameEventDto playerJoined(GameState state, Player player) {
        return new GameEventDto(
                GameEventType.PLAYER_JOINED,
                state.getRoomId(),
                state.getStatus(),
                Instant.now(),
                Map.of(
                        "playerId", player.getId(),
                        "playerName", player.getDisplayName(),
                        "playerCount", state.getPlayers().size()
                )
        );
    }

    public static GameEventDto waitingCountdown(GameState state, long remainingSeconds) {
        return new GameEventDto(
                GameEventType.WAITING_COUNTDOWN,
                state.getRoomId(),
                state.getStatus(),
                Instant.now(),
                Map.of(
                        "remainingSeconds", remainingSeconds,
                        "playerCount", state.getPlayers().size(),
                        "minPlayersToStart", state.getConfig().getMinPlayersToStart()
                )
        );
    }

    public static GameEventDto gameStarted(GameState state) {
        return new GameEventDto(
                GameEventType.GAME_STARTED,
                state.getRoomId(),
                state.getStatus(),
                Instant.now(),
                Map.of(
                        "playerNames", state.turnOrder().stream().map(Player::getDisplayName).toList(),
                        "startingLetter", String.valueOf(state.getCurrentLetter()),
                        "requiredLength", state.getRequiredLength()
                )
        );
    }

    public static GameEventDto turnStarted(GameState state, Player currentPlayer) {
        return new GameEventDto(
                GameEventType.TURN_STARTED,
                state.getRoomId(),
                state.getStatus(),
                Instant.now(),
                Map.of(
                        "currentPlayerId", currentPlayer.getId(),
                        "currentPlayerName", currentPlayer.getDisplayName(),
                        "letter", String.valueOf(state.getCurrentLetter()),
                        "requiredLength", state.getRequiredLength(),
                        "timeoutSeconds", state.getConfig().getTurnTimeoutSeconds()
                )
        );
    }

    public static GameEventDto turnWarning(GameState state, Player currentPlayer, long remainingSeconds) {
        return new GameEventDto(
                GameEventType.TURN_WARNING,
                state.getRoomId(),
                state.getStatus(),
                Instant.now(),
                Map.of(
                        "currentPlayerId", currentPlayer.getId(),
                        "currentPlayerName", currentPlayer.getDisplayName(),
                        "remainingSeconds", remainingSeconds
                )
        );
    }

    public static GameEventDto wordAccepted(GameState state, Player player, String word) {
        return new GameEventDto(
                GameEventType.WORD_ACCEPTED,
                state.getRoomId(),
                state.getStatus(),
                Instant.now(),
                Map.of(
                        "playerName", player.getDisplayName(),
                        "word", word,
                        "nextLetter", String.valueOf(state.getCurrentLetter()),
                        "requiredLength", state.getRequiredLength()
                )
        );
    }

    public static GameEventDto wordRejected(GameState state, long playerId, SubmissionResult result, String message) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("playerId", playerId);
        payload.put("result", result.name());
        payload.put("message", message);

        return new GameEventDto(
                GameEventType.WORD_REJECTED,
                state.getRoomId(),
                state.getStatus(),
                Instant.now(),
                payload
        );
    }

    public static GameEventDto playerEliminated(GameState state, Player eliminated) {
        return new GameEventDto(
                GameEventType.PLAYER_ELIMINATED,
                state.getRoomId(),
                state.getStatus(),
                Instant.now(),
                Map.of(
                        "playerId", eliminated.getId(),
                        "playerName", eliminated.getDisplayName(),
                        "remainingPlayers", state.activePlayers().size()
                )
        );
    }

    public static GameEventDto playerSkipped(GameState state, Player skipped) {
        return new GameEventDto(
                GameEventType.PLAYER_SKIPPED,
                state.getRoomId(),
                state.getStatus(),
                Instant.now(),
                Map.of(
                        "playerId", skipped.getId(),
                        "playerName", skipped.getDisplayName()
                )
        );
    }

    public static GameEventDto playerLeft(GameState state, Player player) {
        return new GameEventDto(
                GameEventType.PLAYER_LEFT,
                state.getRoomId(),
                state.getStatus(),
                Instant.now(),
                Map.of(
                        "playerId", player.getId(),
                        "playerName", player.getDisplayName(),
                        "remainingPlayers", state.activePlayers().size()
                )
        );
    }

    public static GameEventDto gameEnded(GameState state, Player winner, GameEndReason reason) {
        // winner may be null, Map.of rejects null values
        Map<String, Object> payload = new HashMap<>();
        payload.put("reason", reason.name());
        payload.put("winnerPlayerId", winner != null ? winner.getId() : null);
        payload.put("winnerPlayerName", winner != null ? winner.getDisplayName() : null);
        payload.put("wordsPlayed", state.getUsedWords().size());

        return new GameEventDto(
                GameEventType.GAME_ENDED,
                state.getRoomId(),
                state.getStatus(),
                Instant.now(),
                payload
        );
    }
}
