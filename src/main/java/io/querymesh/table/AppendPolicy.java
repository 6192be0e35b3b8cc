package io.querymesh.table;

import io.querymesh.config.QueryMeshSettings;

import java.time.Duration;

public record AppendPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs, Duration lockTimeout) {

    public static AppendPolicy from(QueryMeshSettings settings) {
        return new AppendPolicy(
                settings.appendMaxAttempts(),
                settings.appendBaseBackoffMs(),
                settings.appendMaxBackoffMs(),
                Duration.ofMillis(settings.lockTimeoutMs())
        );
    }

    /**
     * {@code base * 2^attempt}, capped at {@code maxBackoffMs}. {@code attempt} counts from zero.
     */
    public long backoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 0; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                return maxBackoffMs;
            }
            backoff *= 2L;
        }
        return Math.min(backoff, maxBackoffMs);
    }
}
