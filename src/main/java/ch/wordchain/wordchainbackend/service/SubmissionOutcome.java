package ch.wordchain.wordchainbackend.service;

import ch.wordchain.wordchainbackend.domain.enums.SubmissionResult;

/**
 * Result of a word submission.
 *
 * @param result classification of the submission
 * @param message feedback for the submitting player, {@code null} if the submission is ignored silently
 * @param normalizedWord the trimmed lower-case word, {@code null} if normalization was not reached
 */
public record SubmissionOutcome(
        SubmissionResult result,
        String message,
        String normalizedWord
) {
    public boolean accepted() {
        return result == SubmissionResult.VALID_WORD;
    }
}
