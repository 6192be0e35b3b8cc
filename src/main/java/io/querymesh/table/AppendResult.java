package io.querymesh.table;

import java.util.List;

/**
 * Outcome of one {@link SharedTableWriter#append} call, with the disposition of every attempt.
 */
public record AppendResult(
        Status status,
        String batchId,
        int rowsWritten,
        List<AttemptOutcome> attempts,
        String error
) {
    public enum Status { COMMITTED, FAILED }

    public enum AttemptOutcome { COMMITTED, RETRYABLE_CONFLICT, RETRYABLE_LOCK_TIMEOUT, FATAL }

    public AppendResult {
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public static AppendResult committed(String batchId, int rowsWritten, List<AttemptOutcome> attempts) {
        return new AppendResult(Status.COMMITTED, batchId, rowsWritten, attempts, null);
    }

    public static AppendResult failed(String batchId, List<AttemptOutcome> attempts, String error) {
        return new AppendResult(Status.FAILED, batchId, 0, attempts, error);
    }

    public boolean committed() {
        return status == Status.COMMITTED;
    }
}
