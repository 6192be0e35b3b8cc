package io.querymesh.config;

import io.querymesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runtime tunables, loaded from {@code querymesh-settings.json} under the runtime root.
 *
 * <p>Every field in the file is optional. Missing or out-of-range values fall back to
 * {@link #defaults()} field by field, so a partial file never disables the rest.
 */
public record QueryMeshSettings(
        int maxRetries,
        long retryBaseDelayMs,
        long lockTimeoutMs,
        long lockPollIntervalMs,
        String lockBackend,
        int appendMaxAttempts,
        long appendBaseBackoffMs,
        long appendMaxBackoffMs,
        int appendRequestTimeoutSeconds,
        String appendFailurePolicy,
        long taskSoftLimitMs,
        long taskHardLimitMs,
        long reclaimAfterMs,
        int targetShardSize,
        int workerCount,
        long workerPollIntervalMs,
        int retryPromoteLimit,
        String resultTableName,
        String transpilerId,
        List<String> transpilerCommand,
        long transpilerTimeoutMs,
        long sessionRetentionHours
) {
    public static final String LOCK_BACKEND_SHARED = "shared";
    public static final String LOCK_BACKEND_LOCAL = "local";
    public static final String POLICY_FAIL_TASK = "FAIL_TASK";
    public static final String POLICY_DROP_BATCH = "DROP_BATCH";

    public QueryMeshSettings {
        transpilerCommand = transpilerCommand == null ? List.of() : List.copyOf(transpilerCommand);
    }

    public static QueryMeshSettings defaults() {
        return new QueryMeshSettings(
                3,
                60_000L,
                60_000L,
                100L,
                LOCK_BACKEND_SHARED,
                5,
                10_000L,
                300_000L,
                25,
                POLICY_FAIL_TASK,
                3_300_000L,
                3_600_000L,
                3_900_000L,
                10_000,
                4,
                1_000L,
                32,
                "query_results",
                "passthrough",
                List.of(),
                30_000L,
                24L
        );
    }

    public static QueryMeshSettings load(Path file) {
        QueryMeshSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read settings file: " + file, e);
        }
    }

    static QueryMeshSettings fromFile(SettingsFile file, QueryMeshSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long softLimit = sanitizeLong(file.taskSoftLimitMs(), defaults.taskSoftLimitMs(), 1L);
        long hardLimit = sanitizeLong(file.taskHardLimitMs(), Math.max(defaults.taskHardLimitMs(), softLimit), softLimit);
        long appendBase = sanitizeLong(file.appendBaseBackoffMs(), defaults.appendBaseBackoffMs(), 0L);
        long lockTimeout = sanitizeLong(file.lockTimeoutMs(), defaults.lockTimeoutMs(), 1L);
        int requestTimeout = Math.min(
                sanitizeInt(file.appendRequestTimeoutSeconds(), defaults.appendRequestTimeoutSeconds(), 1),
                maxRequestTimeoutSeconds(lockTimeout)
        );
        return new QueryMeshSettings(
                sanitizeInt(file.maxRetries(), defaults.maxRetries(), 0),
                sanitizeLong(file.retryBaseDelayMs(), defaults.retryBaseDelayMs(), 0L),
                lockTimeout,
                sanitizeLong(file.lockPollIntervalMs(), defaults.lockPollIntervalMs(), 1L),
                sanitizeChoice(file.lockBackend(), defaults.lockBackend(), LOCK_BACKEND_SHARED, LOCK_BACKEND_LOCAL),
                sanitizeInt(file.appendMaxAttempts(), defaults.appendMaxAttempts(), 1),
                appendBase,
                sanitizeLong(file.appendMaxBackoffMs(), Math.max(defaults.appendMaxBackoffMs(), appendBase), appendBase),
                requestTimeout,
                sanitizeChoice(file.appendFailurePolicy(), defaults.appendFailurePolicy(), POLICY_FAIL_TASK, POLICY_DROP_BATCH),
                softLimit,
                hardLimit,
                sanitizeLong(file.reclaimAfterMs(), Math.max(defaults.reclaimAfterMs(), hardLimit), hardLimit),
                sanitizeInt(file.targetShardSize(), defaults.targetShardSize(), 1),
                sanitizeInt(file.workerCount(), defaults.workerCount(), 1),
                sanitizeLong(file.workerPollIntervalMs(), defaults.workerPollIntervalMs(), 1L),
                sanitizeInt(file.retryPromoteLimit(), defaults.retryPromoteLimit(), 1),
                sanitizeText(file.resultTableName(), defaults.resultTableName()),
                sanitizeText(file.transpilerId(), defaults.transpilerId()),
                file.transpilerCommand() == null ? defaults.transpilerCommand() : file.transpilerCommand(),
                sanitizeLong(file.transpilerTimeoutMs(), defaults.transpilerTimeoutMs(), 1_000L),
                sanitizeLong(file.sessionRetentionHours(), defaults.sessionRetentionHours(), 1L)
        );
    }

    /**
     * An append commit runs two timed statements while holding a lock that expires after
     * {@code lockTimeoutMs}; both must fit inside it. JDBC timeouts are whole seconds, so the floor is one.
     */
    static int maxRequestTimeoutSeconds(long lockTimeoutMs) {
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, (lockTimeoutMs - 1L) / 2_000L));
    }

    /**
     * How often a worker refreshes its claim while handling a delivery, well inside {@link #reclaimAfterMs()}.
     */
    public long claimHeartbeatMs() {
        return Math.max(10L, Math.min(reclaimAfterMs / 3L, 60_000L));
    }

    public boolean dropBatchOnAppendFailure() {
        return POLICY_DROP_BATCH.equals(appendFailurePolicy);
    }

    /**
     * Delay before redelivery number {@code retryCount + 1}: {@code base * 2^retryCount}.
     */
    public long retryDelayMs(int retryCount) {
        int exponent = Math.max(0, Math.min(retryCount, 30));
        long delay = retryBaseDelayMs << exponent;
        return delay < 0L ? Long.MAX_VALUE : delay;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    private static String sanitizeChoice(String raw, String fallback, String... allowed) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        for (String option : allowed) {
            if (option.equalsIgnoreCase(raw.trim())) {
                return option;
            }
        }
        return fallback;
    }

    record SettingsFile(
            Integer maxRetries,
            Long retryBaseDelayMs,
            Long lockTimeoutMs,
            Long lockPollIntervalMs,
            String lockBackend,
            Integer appendMaxAttempts,
            Long appendBaseBackoffMs,
            Long appendMaxBackoffMs,
            Integer appendRequestTimeoutSeconds,
            String appendFailurePolicy,
            Long taskSoftLimitMs,
            Long taskHardLimitMs,
            Long reclaimAfterMs,
            Integer targetShardSize,
            Integer workerCount,
            Long workerPollIntervalMs,
            Integer retryPromoteLimit,
            String resultTableName,
            String transpilerId,
            List<String> transpilerCommand,
            Long transpilerTimeoutMs,
            Long sessionRetentionHours
    ) {
    }
}
