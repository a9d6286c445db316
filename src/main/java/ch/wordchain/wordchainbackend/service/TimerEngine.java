package ch.wordchain.wordchainbackend.service;

import ch.wordchain.wordchainbackend.domain.TimerHandle;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Runs keyed countdowns on the shared {@link TaskScheduler}.
 *
 * <p>At most one countdown exists per key: starting a new one cancels the previous one.
 * A countdown ticks at a fixed rate, delivers each warning once when its threshold is
 * crossed and finally delivers the timeout. Callbacks run on scheduler threads; failures
 * inside them are logged and never stop the engine.
 *
 * <p>Cancellation is cooperative. A cancelled handle is flagged and its scheduled task is
 * cancelled without interrupting; a tick that is already running sees the flag and returns.
 */
@Component
@Slf4j
public class TimerEngine {

    private final TaskScheduler taskScheduler;

    private final Duration tickInterval;

    private final Map<String, TimerHandle> timers = new ConcurrentHashMap<>();

    public TimerEngine(TaskScheduler taskScheduler,
                       @Value("${game.timer.tick-ms:250}") long tickMs) {
        if (tickMs <= 0) {
            throw new IllegalArgumentException("Timer tick must be positive: " + tickMs);
        }
        this.taskScheduler = taskScheduler;
        this.tickInterval = Duration.ofMillis(tickMs);
    }

    /**
     * Starts a countdown for the key, replacing any running one.
     *
     * @param key timer key (room id, or a derived key for secondary timers)
     * @param duration time until the timeout fires
     * @param onTimeout called once with the key when the countdown ends
     * @param onWarning called with the key and the remaining time for each crossed offset
     * @param warningOffsets remaining-time thresholds for warnings
     * @return handle of the new countdown
     */
    public TimerHandle start(String key,
                             Duration duration,
                             Consumer<String> onTimeout,
                             BiConsumer<String, Duration> onWarning,
                             List<Duration> warningOffsets) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Timer duration must not be negative: " + duration);
        }
        Instant now = Instant.now();
        List<Duration> offsets = duration.isZero()
                ? List.of()
                : warningOffsets.stream().filter(o -> o.compareTo(duration) < 0).toList();
        TimerHandle handle = new TimerHandle(key, now.plus(duration), offsets);

        // swap and cancel whatever was displaced, so concurrent starts leave one live timer
        TimerHandle previous = timers.put(key, handle);
        if (previous != null && previous.cancel()) {
            log.debug("Superseded timer {}", key);
        }

        ScheduledFuture<?> future;
        if (duration.isZero()) {
            future = taskScheduler.schedule(() -> expire(handle, onTimeout), now);
        } else {
            future = taskScheduler.scheduleAtFixedRate(
                    () -> tick(handle, onTimeout, onWarning),
                    now.plus(tickInterval),
                    tickInterval
            );
        }
        handle.attach(future);

        log.debug("Started timer {} for {} (warnings at {})", key, duration, offsets);
        return handle;
    }

    /**
     * Cancels the running countdown for the key.
     *
     * @param key timer key
     * @return {@code true} if a running countdown was stopped, {@code false} otherwise
     */
    public boolean cancel(String key) {
        TimerHandle handle = timers.get(key);
        if (handle == null) {
            return false;
        }
        boolean cancelled = handle.cancel();
        timers.remove(key, handle);
        if (cancelled) {
            log.debug("Cancelled timer {}", key);
        }
        return cancelled;
    }

    public boolean isActive(String key) {
        TimerHandle handle = timers.get(key);
        return handle != null && handle.isRunning();
    }

    public int activeCount() {
        return (int) timers.values().stream().filter(TimerHandle::isRunning).count();
    }

    /**
     * Cancels every running countdown, e.g. on shutdown.
     */
    @PreDestroy
    public void cancelAll() {
        int cancelled = 0;
        for (String key : List.copyOf(timers.keySet())) {
            if (cancel(key)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} running timer(s)", cancelled);
        }
    }

    private void tick(TimerHandle handle,
                      Consumer<String> onTimeout,
                      BiConsumer<String, Duration> onWarning) {
        if (!handle.isRunning()) {
            return;
        }
        Duration remaining = handle.remaining(Instant.now());

        if (!remaining.isZero()) {
            for (Duration offset : handle.getWarningOffsets()) {
                if (remaining.compareTo(offset) <= 0 && handle.markWarningFired(offset)) {
                    if (!handle.isRunning()) {
                        return;
                    }
                    try {
                        onWarning.accept(handle.getKey(), remaining);
                    } catch (RuntimeException e) {
                        log.error("Warning callback failed for timer {}", handle.getKey(), e);
                    }
                }
            }
            return;
        }
        expire(handle, onTimeout);
    }

    private void expire(TimerHandle handle, Consumer<String> onTimeout) {
        if (!handle.expire()) {
            return;
        }
        timers.remove(handle.getKey(), handle);
        log.debug("Timer {} expired", handle.getKey());
        try {
            onTimeout.accept(handle.getKey());
        } catch (RuntimeException e) {
            log.error("Timeout callback failed for timer {}", handle.getKey(), e);
        }
    }
}
