package io.querymesh.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queue payload for one (file, shard) unit of work. The wire form uses snake_case keys.
 */
public record TaskDescriptor(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("remainder") int remainder,
        @JsonProperty("total_shards") int totalShards,
        @JsonProperty("query_column") String queryColumn,
        @JsonProperty("from_dialect") String fromDialect,
        @JsonProperty("to_dialect") String toDialect,
        @JsonProperty("estimated_unique_per_shard") long estimatedUniquePerShard,
        @JsonProperty("feature_flags") Map<String, Object> featureFlags,
        @JsonProperty("filters") Map<String, String> filters,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("created_at_ms") long createdAtMs
) {
    public TaskDescriptor {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("task_id cannot be empty");
        }
        if (totalShards <= 0 || remainder < 0 || remainder >= totalShards) {
            throw new IllegalArgumentException(
                    "remainder must be in [0, total_shards): remainder=" + remainder + ", total_shards=" + totalShards
            );
        }
        featureFlags = featureFlags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(featureFlags));
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    public TaskDescriptor withRetryCount(int nextRetryCount) {
        return new TaskDescriptor(
                taskId,
                sessionId,
                filePath,
                remainder,
                totalShards,
                queryColumn,
                fromDialect,
                toDialect,
                estimatedUniquePerShard,
                featureFlags,
                filters,
                nextRetryCount,
                createdAtMs
        );
    }
}
