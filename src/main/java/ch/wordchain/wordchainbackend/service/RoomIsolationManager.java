package ch.wordchain.wordchainbackend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes all operations on one room while letting different rooms run in parallel.
 *
 * <p>Each room gets its own gate (a {@link ReentrantLock}) created lazily and atomically.
 * There is no global lock: the gate map is only touched through single atomic operations.
 * Gates are reentrant, so an operation running under a room's gate may call other operations
 * that lock the same room (e.g. a timeout that ends the game and stops the room).
 */
@Service
@Slf4j
public class RoomIsolationManager {

    private final Map<String, RoomGate> gates = new ConcurrentHashMap<>();

    /**
     * Runs an operation exclusively for the given room.
     *
     * @param roomId room to lock
     * @param operation work to run under the room's gate
     * @param <T> result type
     * @return the operation's result
     */
    public <T> T withRoomLock(String roomId, Supplier<T> operation) {
        while (true) {
            RoomGate gate = gates.computeIfAbsent(roomId, id -> new RoomGate());
            gate.lock.lock();
            try {
                // the gate may have been reclaimed between lookup and lock
                if (gates.get(roomId) != gate) {
                    continue;
                }
                gate.lastAccess = Instant.now();
                return operation.get();
            } finally {
                gate.lastAccess = Instant.now();
                gate.lock.unlock();
            }
        }
    }

    public void withRoomLock(String roomId, Runnable operation) {
        withRoomLock(roomId, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * Removes gates that were not used since the cutoff and are neither held nor awaited.
     *
     * @param cutoff last-access threshold
     * @return number of gates removed
     */
    public int reclaimIdle(Instant cutoff) {
        int removed = 0;
        for (Map.Entry<String, RoomGate> entry : gates.entrySet()) {
            RoomGate gate = entry.getValue();
            if (!gate.lastAccess.isBefore(cutoff)) {
                continue;
            }
            if (!gate.lock.tryLock()) {
                continue;
            }
            try {
                if (!gate.lock.hasQueuedThreads() && gates.remove(entry.getKey(), gate)) {
                    removed++;
                }
            } finally {
                gate.lock.unlock();
            }
        }
        if (removed > 0) {
            log.info("Reclaimed {} idle room gate(s) unused since {}", removed, cutoff);
        }
        return removed;
    }

    public Set<String> activeRoomIds() {
        return Set.copyOf(gates.keySet());
    }

    public int gateCount() {
        return gates.size();
    }

    public boolean isLocked(String roomId) {
        RoomGate gate = gates.get(roomId);
        return gate != null && gate.lock.isLocked();
    }

    private static final class RoomGate {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile Instant lastAccess = Instant.now();
    }
}
