package ch.wordchain.wordchainbackend.domain.enums;

public enum SubmissionResult {
    VALID_WORD,
    INVALID_LETTER,
    INVALID_LENGTH,
    INVALID_WORD,
    WRONG_PLAYER,
    NO_ACTIVE_GAME,
    /**
     * The dictionary could not give an answer. The player may simply try again.
     */
    VALIDATION_ERROR
}
