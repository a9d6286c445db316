package ch.wordchain.wordchainbackend.exception;

import ch.wordchain.wordchainbackend.domain.enums.LoadLevel;
import lombok.Getter;

/**
 * Thrown when a new room cannot be created because the system is at capacity.
 * No room is created in that case.
 */
@Getter
public class AdmissionDeniedException extends RuntimeException {

    private final LoadLevel loadLevel;

    public AdmissionDeniedException(String reason, LoadLevel loadLevel) {
        super(reason);
        this.loadLevel = loadLevel;
    }
}
