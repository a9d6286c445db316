package ch.wordchain.wordchainbackend.exception;

/**
 * Signals that the dictionary could not answer (lookup service down, list not loaded).
 * Callers treat the word as neither valid nor invalid and ask the player to retry.
 */
public class DictionaryUnavailableException extends RuntimeException {

    public DictionaryUnavailableException(String message) {
        super(message);
    }

    public DictionaryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
