package io.querymesh.table;

import io.querymesh.lock.DistributedLock;
import io.querymesh.lock.LockGuard;
import io.querymesh.lock.LockTimeoutException;
import io.querymesh.model.ResultRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The only path that writes to the shared result table.
 *
 * <p>Each attempt takes {@code append:<batchId>}, commits the whole batch as one write and
 * releases the lock in a finally block. Table conflicts and lock timeouts back off
 * exponentially and retry; a conflict also reloads the table handle first. Anything else ends
 * the loop at once. Appends are at-least-once: a retry after an ambiguous failure may duplicate rows.
 */
public final class SharedTableWriter {
    private static final Logger logger = LoggerFactory.getLogger(SharedTableWriter.class);
    public static final String LOCK_PREFIX = "append:";

    private final DistributedLock lock;
    private final ResultTable table;
    private final AppendPolicy policy;

    public SharedTableWriter(DistributedLock lock, ResultTable table, AppendPolicy policy) {
        this.lock = lock;
        this.table = table;
        this.policy = policy;
    }

    public ResultTable table() {
        return table;
    }

    public AppendResult append(List<ResultRow> rows, String batchId) {
        List<AppendResult.AttemptOutcome> attempts = new ArrayList<>();
        if (rows.isEmpty()) {
            return AppendResult.committed(batchId, 0, attempts);
        }
        String lockName = LOCK_PREFIX + batchId;
        String lastError = null;
        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            boolean conflict = false;
            LockGuard guard;
            try {
                guard = lock.acquire(lockName, policy.lockTimeout());
            } catch (LockTimeoutException e) {
                attempts.add(AppendResult.AttemptOutcome.RETRYABLE_LOCK_TIMEOUT);
                lastError = e.getMessage();
                logger.warn("Timeout acquiring lock for batch {} (attempt {}/{})", batchId, attempt + 1, policy.maxAttempts());
                if (!backoff(attempt)) {
                    break;
                }
                continue;
            }
            try {
                int written = table.append(rows);
                attempts.add(AppendResult.AttemptOutcome.COMMITTED);
                logger.info("Stored {} results for batch {}", written, batchId);
                return AppendResult.committed(batchId, written, attempts);
            } catch (TableConflictException e) {
                attempts.add(AppendResult.AttemptOutcome.RETRYABLE_CONFLICT);
                lastError = e.getMessage();
                conflict = true;
                logger.warn("Concurrent write conflict for batch {} (attempt {}/{})", batchId, attempt + 1, policy.maxAttempts());
            } catch (RuntimeException e) {
                attempts.add(AppendResult.AttemptOutcome.FATAL);
                logger.error("Unexpected error storing batch {}", batchId, e);
                return AppendResult.failed(batchId, attempts, describe(e));
            } finally {
                lock.release(guard);
            }
            if (!backoff(attempt)) {
                break;
            }
            if (conflict) {
                table.refresh();
            }
        }
        logger.error("Failed to store batch {} after {} attempts", batchId, attempts.size());
        return AppendResult.failed(batchId, attempts, lastError == null ? "append retries exhausted" : lastError);
    }

    /**
     * Sleeps before the next attempt. Returns false when no attempt is left or the thread was interrupted.
     */
    private boolean backoff(int attempt) {
        if (attempt + 1 >= policy.maxAttempts()) {
            return false;
        }
        long waitMs = policy.backoffMs(attempt);
        if (waitMs <= 0L) {
            return true;
        }
        try {
            Thread.sleep(waitMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
