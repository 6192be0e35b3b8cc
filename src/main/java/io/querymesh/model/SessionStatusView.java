package io.querymesh.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Polled progress of one session.
 */
public record SessionStatusView(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("status") String status,
        @JsonProperty("progress") Progress progress,
        @JsonProperty("performance") Performance performance
) {
    public record Progress(
            @JsonProperty("total_shards") int totalShards,
            @JsonProperty("completed") int completed,
            @JsonProperty("failed") int failed,
            @JsonProperty("processing") int processing,
            @JsonProperty("pending") int pending,
            @JsonProperty("completion_percentage") double completionPercentage
    ) {
    }

    public record Performance(
            @JsonProperty("elapsed_seconds") double elapsedSeconds,
            @JsonProperty("estimated_remaining_seconds") double estimatedRemainingSeconds,
            @JsonProperty("shards_per_second") double shardsPerSecond
    ) {
    }
}
