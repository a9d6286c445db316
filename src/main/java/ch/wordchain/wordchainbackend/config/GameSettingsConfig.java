package ch.wordchain.wordchainbackend.config;

import ch.wordchain.wordchainbackend.domain.GameConfiguration;
import ch.wordchain.wordchainbackend.domain.enums.TimeoutPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * Builds the {@link GameConfiguration} new rooms are created with from {@code game.*} properties.
 * Defaults match {@link GameConfiguration#defaultConfig()}.
 */
@Configuration
@Slf4j
public class GameSettingsConfig {

    @Bean
    public GameConfiguration gameConfiguration(
            @Value("${game.turn-timeout-seconds:30}") int turnTimeoutSeconds,
            @Value("${game.min-word-length:2}") int minWordLength,
            @Value("${game.max-word-length:20}") int maxWordLength,
            @Value("${game.max-players-per-room:10}") int maxPlayersPerRoom,
            @Value("${game.warning-offsets-seconds:15,10,5}") int[] warningOffsetsSeconds,
            @Value("${game.min-players-to-start:2}") int minPlayersToStart,
            @Value("${game.waiting-period-seconds:60}") int waitingPeriodSeconds,
            @Value("${game.waiting-warning-offsets-seconds:30,20,10}") int[] waitingWarningOffsetsSeconds,
            @Value("${game.timeout-policy:ELIMINATE}") TimeoutPolicy timeoutPolicy) {

        GameConfiguration config = new GameConfiguration(
                turnTimeoutSeconds,
                minWordLength,
                maxWordLength,
                maxPlayersPerRoom,
                toList(warningOffsetsSeconds),
                minPlayersToStart,
                waitingPeriodSeconds,
                toList(waitingWarningOffsetsSeconds),
                timeoutPolicy
        );
        log.info("Game settings: {}s turns, words {}-{} letters, {}-{} players, timeout policy {}",
                turnTimeoutSeconds, minWordLength, maxWordLength, minPlayersToStart, maxPlayersPerRoom, timeoutPolicy);
        return config;
    }

    private static List<Integer> toList(int[] values) {
        return Arrays.stream(values).boxed().toList();
    }
}
