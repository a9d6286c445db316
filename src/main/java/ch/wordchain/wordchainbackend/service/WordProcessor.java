package ch.wordchain.wordchainbackend.service;

import ch.wordchain.wordchainbackend.domain.GameState;
import ch.wordchain.wordchainbackend.domain.Player;
import ch.wordchain.wordchainbackend.domain.StartingLetters;
import ch.wordchain.wordchainbackend.domain.enums.Difficulty;
import ch.wordchain.wordchainbackend.domain.enums.SubmissionResult;
import ch.wordchain.wordchainbackend.exception.DictionaryUnavailableException;
import ch.wordchain.wordchainbackend.service.dictionary.DictionaryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validates submitted words against a room's state and computes the state after an accepted word.
 *
 * <p>Checks run in a fixed order and the first failure wins:
 * <ol>
 *   <li>an active game with a resolvable current player</li>
 *   <li>the submitter holds the turn</li>
 *   <li>the word consists of ASCII letters {@code a-z} only and is not longer than the configured
 *       maximum; the dictionaries are English, so accented and non-Latin letters are rejected</li>
 *   <li>the word was not used before in this room</li>
 *   <li>starting letter, then minimum length (longer words are fine)</li>
 *   <li>dictionary lookup</li>
 * </ol>
 *
 * <p>A rejected submission never changes the state. Callers must hold the room's gate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WordProcessor {

    private static final Pattern ALPHABETIC = Pattern.compile("[a-z]+");

    private final DictionaryService dictionaryService;

    public SubmissionOutcome submit(GameState state, long playerId, String rawWord) {
        if (state == null || !state.isActive()) {
            return reject(SubmissionResult.NO_ACTIVE_GAME, "No active game in this room", null);
        }
        Optional<Player> current = state.currentPlayer();
        if (current.isEmpty()) {
            return reject(SubmissionResult.NO_ACTIVE_GAME, "No player holds the turn", null);
        }
        if (current.get().getId() != playerId) {
            // outsiders are ignored without feedback
            String message = state.isMember(playerId)
                    ? "It's " + current.get().getDisplayName() + "'s turn"
                    : null;
            return reject(SubmissionResult.WRONG_PLAYER, message, null);
        }

        String word = rawWord == null ? "" : rawWord.trim().toLowerCase(Locale.ROOT);
        if (word.isEmpty()) {
            return reject(SubmissionResult.INVALID_WORD, "Please send a word", word);
        }
        if (!ALPHABETIC.matcher(word).matches()) {
            return reject(SubmissionResult.INVALID_WORD, "Words may only contain the letters a to z", word);
        }
        int maxLength = state.getConfig().getMaxWordLength();
        if (word.length() > maxLength) {
            return reject(SubmissionResult.INVALID_WORD, "Words may be at most " + maxLength + " letters long", word);
        }
        if (state.isWordUsed(word)) {
            return reject(SubmissionResult.INVALID_WORD, "'" + word + "' has already been used", word);
        }

        char required = Character.toLowerCase(state.getCurrentLetter());
        if (word.charAt(0) != required) {
            return reject(SubmissionResult.INVALID_LETTER,
                    "Word must start with '" + Character.toUpperCase(required) + "'", word);
        }
        if (word.length() < state.getRequiredLength()) {
            return reject(SubmissionResult.INVALID_LENGTH,
                    "Word must be at least " + state.getRequiredLength() + " letters long (yours is " + word.length() + ")",
                    word);
        }

        boolean known;
        try {
            known = dictionaryService.isValid(word);
        } catch (DictionaryUnavailableException e) {
            log.warn("Dictionary unavailable while checking '{}' in room {}: {}", word, state.getRoomId(), e.getMessage());
            return reject(SubmissionResult.VALIDATION_ERROR, "Could not check the word right now, please try again", word);
        } catch (RuntimeException e) {
            log.error("Dictionary failed while checking '{}' in room {}", word, state.getRoomId(), e);
            return reject(SubmissionResult.VALIDATION_ERROR, "Could not check the word right now, please try again", word);
        }
        if (!known) {
            return reject(SubmissionResult.INVALID_WORD, "'" + word + "' is not in the dictionary", word);
        }

        state.recordUsedWord(word);
        return new SubmissionOutcome(SubmissionResult.VALID_WORD, "'" + word + "' accepted", word);
    }

    /**
     * Applies an accepted word: the next word starts with its last letter, the turn moves on and
     * the minimum length grows by one every second completed round.
     *
     * @param acceptedWord normalized accepted word
     * @param state room state
     */
    public void computeNextState(String acceptedWord, GameState state) {
        state.setCurrentLetter(acceptedWord.charAt(acceptedWord.length() - 1));
        state.advanceTurn();
        state.incrementRoundTurns();

        if (state.getCurrentRoundTurns() >= state.getPlayers().size()) {
            state.completeRound();
            if (state.getRoundsCompleted() % 2 == 0) {
                state.increaseRequiredLength();
                log.info("Room {} completed {} rounds, minimum length is now {}",
                        state.getRoomId(), state.getRoundsCompleted(), state.getRequiredLength());
            }
        }
        log.debug("Room {} next: letter={}, minLength={}, player={}",
                state.getRoomId(), state.getCurrentLetter(), state.getRequiredLength(),
                state.currentPlayer().map(Player::toString).orElse("-"));
    }

    public String hint(GameState state) {
        char letter = state.getCurrentLetter();
        char lower = Character.toLowerCase(letter);
        int length = state.getRequiredLength();
        return switch (length) {
            case 1 -> "Need a 1-letter word starting with '" + letter + "' (like '" + lower + "')";
            case 2 -> "Need a 2-letter word starting with '" + letter + "' (like '" + lower + "o')";
            case 3 -> "Need a 3-letter word starting with '" + letter + "' (like '" + lower + "at')";
            default -> "Need a " + length + "-letter word starting with '" + letter + "'";
        };
    }

    public Difficulty difficulty(GameState state) {
        int length = state.getRequiredLength();
        if (length >= 10) {
            return Difficulty.VERY_HARD;
        }
        if (length >= 7) {
            return Difficulty.HARD;
        }
        if (length >= 5) {
            return Difficulty.MODERATE;
        }
        if (StartingLetters.isTricky(state.getCurrentLetter())) {
            return Difficulty.TRICKY_LETTER;
        }
        return Difficulty.EASY;
    }

    private SubmissionOutcome reject(SubmissionResult result, String message, String word) {
        return new SubmissionOutcome(result, message, word);
    }
}
