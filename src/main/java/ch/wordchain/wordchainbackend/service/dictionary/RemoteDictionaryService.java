package ch.wordchain.wordchainbackend.service.dictionary;

import ch.wordchain.wordchainbackend.exception.DictionaryUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dictionary that asks a remote lookup API whether a word exists.
 *
 * <p>The API answers 200 for known words and 404 for unknown ones; anything else (connection
 * failure, 5xx, rate limiting) is reported as {@link DictionaryUnavailableException}. Answers
 * are kept in a bounded least-recently-used cache, failures are never cached.
 */
@Service
@ConditionalOnProperty(name = "game.dictionary.provider", havingValue = "remote")
@Slf4j
public class RemoteDictionaryService implements DictionaryService {

    private final RestClient restClient;

    private final Map<String, Boolean> cache;

    private volatile boolean available = true;

    public RemoteDictionaryService(RestClient.Builder restClientBuilder,
                                   @Value("${game.dictionary.remote.base-url:https://api.dictionaryapi.dev/api/v2/entries/en}") String baseUrl,
                                   @Value("${game.dictionary.remote.cache-size:1000}") int cacheSize) {
        this.restClient = restClientBuilder.baseUrl(baseUrl).build();
        this.cache = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > cacheSize;
            }
        });
    }

    @Override
    public boolean isValid(String word) {
        Boolean cached = cache.get(word);
        if (cached != null) {
            return cached;
        }
        boolean valid = lookup(word);
        cache.put(word, valid);
        return valid;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    public int cacheSize() {
        return cache.size();
    }

    private boolean lookup(String word) {
        try {
            restClient.get()
                    .uri("/{word}", word)
                    .retrieve()
                    .toBodilessEntity();
            available = true;
            return true;
        } catch (HttpClientErrorException.NotFound e) {
            available = true;
            return false;
        } catch (RestClientException e) {
            available = false;
            log.warn("Dictionary lookup for '{}' failed: {}", word, e.getMessage());
            throw new DictionaryUnavailableException("Dictionary service unavailable", e);
        }
    }
}
