package ch.wordchain.wordchainbackend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for task scheduling.
 *
 * <p>Provides the {@link TaskScheduler} shared by:
 * <ul>
 *   <li>@Scheduled methods (RoomCleanupService, SystemStatusService)</li>
 *   <li>Programmatic scheduling (turn and waiting countdowns in TimerEngine)</li>
 * </ul>
 */
@Configuration
public class SchedulingConfig {

    /**
     * Creates a task scheduler with a configurable thread pool.
     *
     * <p>Configuration:
     * <ul>
     *   <li>Pool size: {@code game.scheduler.pool-size} threads (default 8); countdown ticks of all rooms share them</li>
     *   <li>Thread name prefix: "wordchain-scheduler-" for easier debugging</li>
     *   <li>Cancelled ticks are removed from the queue right away</li>
     *   <li>Primary over the STOMP broker's own scheduler</li>
     * </ul>
     *
     * @param poolSize number of scheduler threads
     * @return configured task scheduler
     */
    @Bean
    @Primary
    public TaskScheduler taskScheduler(@Value("${game.scheduler.pool-size:8}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("wordchain-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
