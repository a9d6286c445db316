package ch.wordchain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the word chain backend.
 *
 * <p>Enables:
 * <ul>
 *   <li>Spring Boot auto-configuration</li>
 *   <li>Component scanning for the entire application</li>
 *   <li>Scheduled task execution ({@code @EnableScheduling}) for the cleanup sweep and status log</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class WordChainBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(WordChainBackendApplication.class, args);
    }

}
