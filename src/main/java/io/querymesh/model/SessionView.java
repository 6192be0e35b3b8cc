package io.querymesh.model;

import java.util.List;

public record SessionView(
        String sessionId,
        String sourcePath,
        String fromDialect,
        String toDialect,
        String queryColumn,
        int totalFiles,
        long totalQueries,
        long uniqueQueries,
        int totalShards,
        String status,
        int pendingCount,
        int processingCount,
        int completedCount,
        int failedCount,
        List<FileStats> fileStats,
        String lastError,
        long createdAtMs,
        long updatedAtMs,
        Long finishedAtMs
) {
    public SessionView {
        fileStats = fileStats == null ? List.of() : List.copyOf(fileStats);
    }

    public SessionStatus sessionStatus() {
        return SessionStatus.fromString(status);
    }
}
