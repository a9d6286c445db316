package ch.wordchain.wordchainbackend.domain;

import ch.wordchain.wordchainbackend.domain.enums.TimerState;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellable token for one countdown bound to one key.
 *
 * <p>The state moves exactly once from {@link TimerState#RUNNING} to either
 * {@link TimerState#CANCELLED} or {@link TimerState#EXPIRED}; whichever side wins that
 * transition decides whether the timeout callback runs. The handle also remembers which
 * warning offsets have fired so no warning is delivered twice.
 */
public class TimerHandle {

    @Getter
    private final String key;

    @Getter
    private final Instant deadline;

    /**
     * Warning thresholds, sorted descending.
     */
    @Getter
    private final List<Duration> warningOffsets;

    private final Set<Duration> firedWarnings = ConcurrentHashMap.newKeySet();

    private final AtomicReference<TimerState> state = new AtomicReference<>(TimerState.RUNNING);

    private volatile ScheduledFuture<?> future;

    public TimerHandle(String key, Instant deadline, List<Duration> warningOffsets) {
        this.key = key;
        this.deadline = deadline;
        this.warningOffsets = warningOffsets.stream()
                .distinct()
                .sorted((a, b) -> b.compareTo(a))
                .toList();
    }

    public TimerState getState() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == TimerState.RUNNING;
    }

    /**
     * @return {@code true} if this call moved the timer from running to cancelled
     */
    public boolean cancel() {
        boolean cancelled = state.compareAndSet(TimerState.RUNNING, TimerState.CANCELLED);
        if (cancelled) {
            stopTicking();
        }
        return cancelled;
    }

    /**
     * @return {@code true} if this call moved the timer from running to expired
     */
    public boolean expire() {
        boolean expired = state.compareAndSet(TimerState.RUNNING, TimerState.EXPIRED);
        if (expired) {
            stopTicking();
        }
        return expired;
    }

    /**
     * Marks a warning offset as delivered.
     *
     * @param offset warning threshold
     * @return {@code true} if the warning had not fired before
     */
    public boolean markWarningFired(Duration offset) {
        return firedWarnings.add(offset);
    }

    public Set<Duration> getFiredWarnings() {
        return Set.copyOf(firedWarnings);
    }

    public Duration remaining(Instant now) {
        Duration remaining = Duration.between(now, deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Binds the scheduled tick task to this handle. If the handle already finished, the task is
     * stopped right away.
     *
     * @param future scheduled tick task
     */
    public void attach(ScheduledFuture<?> future) {
        this.future = future;
        if (!isRunning()) {
            stopTicking();
        }
    }

    private void stopTicking() {
        ScheduledFuture<?> f = this.future;
        if (f != null) {
            // cooperative: a callback that is already running is never interrupted
            f.cancel(false);
        }
    }
}
