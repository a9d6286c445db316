package ch.wordchain.wordchainbackend.service.dictionary;

import ch.wordchain.wordchainbackend.exception.DictionaryUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dictionary backed by a plain word list, one word per line. Lines starting with {@code #}
 * are ignored.
 *
 * <p>If the list cannot be read the service stays up but reports itself unavailable, and every
 * lookup fails with {@link DictionaryUnavailableException}.
 */
@Service
@ConditionalOnProperty(name = "game.dictionary.provider", havingValue = "wordlist", matchIfMissing = true)
@Slf4j
public class WordListDictionaryService implements DictionaryService {

    private final Set<String> words;

    public WordListDictionaryService(
            @Value("${game.dictionary.word-list:classpath:dictionary/words.txt}") Resource wordList) {
        this.words = load(wordList);
    }

    @Override
    public boolean isValid(String word) {
        if (words == null) {
            throw new DictionaryUnavailableException("Word list is not loaded");
        }
        return words.contains(word.toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean isAvailable() {
        return words != null;
    }

    public int size() {
        return words == null ? 0 : words.size();
    }

    private static Set<String> load(Resource wordList) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(wordList.getInputStream(), StandardCharsets.UTF_8))) {
            Set<String> loaded = reader.lines()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .map(line -> line.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet());
            log.info("Loaded {} words from {}", loaded.size(), wordList.getDescription());
            return loaded;
        } catch (IOException e) {
            log.error("Could not load word list {}", wordList.getDescription(), e);
            return null;
        }
    }
}
