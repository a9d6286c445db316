package ch.wordchain.wordchainbackend.web.api.dto;

import ch.wordchain.wordchainbackend.domain.enums.Difficulty;
import ch.wordchain.wordchainbackend.domain.enums.GameStatus;

import java.util.List;

/**
 * Public view of a room.
 *
 * @param roomId room identifier
 * @param status room status
 * @param players players in turn order, starting with the current one
 * @param currentPlayerId id of the player holding the turn, {@code null} if none
 * @param currentPlayerName name of the player holding the turn, {@code null} if none
 * @param currentLetter letter the next word has to start with
 * @param requiredLength minimum length of the next word
 * @param usedWords words accepted so far, in order
 * @param remainingTurnSeconds seconds left in the current turn, {@code null} while waiting
 * @param roundsCompleted completed rounds
 * @param hint text hint for the current requirement
 * @param difficulty difficulty of the current requirement
 */
public record RoomStateDto(
        String roomId,
        GameStatus status,
        List<PlayerDto> players,
        Long currentPlayerId,
        String currentPlayerName,
        String currentLetter,
        int requiredLength,
        List<String> usedWords,
        Long remainingTurnSeconds,
        int roundsCompleted,
        String hint,
        Difficulty difficulty
) {}
