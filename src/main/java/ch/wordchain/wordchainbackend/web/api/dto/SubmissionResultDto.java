package ch.wordchain.wordchainbackend.web.api.dto;

import ch.wordchain.wordchainbackend.domain.enums.SubmissionResult;
import ch.wordchain.wordchainbackend.service.SubmissionOutcome;

/**
 * Result of a word submission as returned to the submitting client.
 *
 * @param result classification of the submission
 * @param accepted whether the word was accepted
 * @param message feedback for the player, may be {@code null}
 * @param word normalized word, may be {@code null}
 */
public record SubmissionResultDto(
        SubmissionResult result,
        boolean accepted,
        String message,
        String word
) {

    public static SubmissionResultDto from(SubmissionOutcome outcome) {
        return new SubmissionResultDto(
                outcome.result(),
                outcome.accepted(),
                outcome.message(),
                outcome.normalizedWord()
        );
    }
}
