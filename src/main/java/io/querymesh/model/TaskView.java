package io.querymesh.model;

public record TaskView(
        String taskId,
        String sessionId,
        String filePath,
        int remainder,
        int totalShards,
        long estimatedUniqueCount,
        String status,
        String workerId,
        int retryCount,
        String resultPayload,
        String lastError,
        long createdAtMs,
        long updatedAtMs,
        Long finishedAtMs
) {
    public TaskStatus taskStatus() {
        return TaskStatus.fromString(status);
    }
}
