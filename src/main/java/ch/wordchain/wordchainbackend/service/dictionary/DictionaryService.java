package ch.wordchain.wordchainbackend.service.dictionary;

import ch.wordchain.wordchainbackend.exception.DictionaryUnavailableException;

/**
 * Decides whether a word exists.
 *
 * <p>Implementations receive normalized words: trimmed, lower-case and made of the ASCII
 * letters {@code a-z} only.
 */
public interface DictionaryService {

    /**
     * @param word normalized word
     * @return {@code true} if the word is known
     * @throws DictionaryUnavailableException if the lookup could not be performed
     */
    boolean isValid(String word);

    /**
     * @return whether lookups are currently expected to succeed
     */
    boolean isAvailable();
}
