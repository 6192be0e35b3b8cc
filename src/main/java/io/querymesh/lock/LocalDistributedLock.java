package io.querymesh.lock;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local fallback with the same token and expiry rules as the shared lock. It only
 * excludes threads of this JVM.
 */
public final class LocalDistributedLock implements DistributedLock {
    private final Map<String, LockGuard> held = new ConcurrentHashMap<>();
    private final long pollIntervalMs;

    public LocalDistributedLock(long pollIntervalMs) {
        this.pollIntervalMs = Math.max(1L, pollIntervalMs);
    }

    @Override
    public LockGuard acquire(String name, Duration timeout) throws LockTimeoutException {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("lock name cannot be empty");
        }
        long timeoutMs = Math.max(1L, timeout.toMillis());
        long deadline = Instant.now().toEpochMilli() + timeoutMs;
        String token = "lock_" + UUID.randomUUID();
        while (true) {
            long now = Instant.now().toEpochMilli();
            LockGuard candidate = new LockGuard(name, token, now, now + timeoutMs);
            LockGuard winner = held.compute(name, (key, existing) ->
                    existing == null || existing.expiresAtMs() <= now ? candidate : existing);
            if (winner == candidate) {
                return candidate;
            }
            long remaining = deadline - Instant.now().toEpochMilli();
            if (remaining <= 0L) {
                throw new LockTimeoutException(name, timeout);
            }
            try {
                Thread.sleep(Math.min(pollIntervalMs, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for lock " + name, e);
            }
        }
    }

    @Override
    public boolean release(LockGuard guard) {
        if (guard == null) {
            return false;
        }
        return held.remove(guard.name(), guard);
    }

    @Override
    public boolean shared() {
        return false;
    }
}
