package io.querymesh.runtime;

import io.querymesh.bus.TaskQueue;
import io.querymesh.config.QueryMeshSettings;
import io.querymesh.model.TaskDescriptor;
import io.querymesh.model.TaskStatus;
import io.querymesh.model.TaskView;
import io.querymesh.observability.AuditLogger;
import io.querymesh.storage.SessionStore;
import io.querymesh.storage.TaskTransitionException;
import io.querymesh.table.AppendResult;
import io.querymesh.table.SharedTableWriter;
import io.querymesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handles one delivery at a time for a single worker identity.
 *
 * <p>The delivery is acknowledged only after the task's terminal status (or its rescheduled
 * retry) is recorded. If the session store fails midway the delivery stays claimed and is later
 * redelivered by {@link TaskQueue#reclaimStale(long)}.
 */
public final class Worker implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    private final String workerId;
    private final QueryMeshSettings settings;
    private final SessionStore sessionStore;
    private final TaskQueue taskQueue;
    private final TaskExecutor executor;
    private final SharedTableWriter writer;
    private final AuditLogger auditLogger;
    private final ScheduledExecutorService watchdog;
    private ExecutorService runner;

    public Worker(
            String workerId,
            QueryMeshSettings settings,
            SessionStore sessionStore,
            TaskQueue taskQueue,
            TaskExecutor executor,
            SharedTableWriter writer,
            AuditLogger auditLogger
    ) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("worker id cannot be empty");
        }
        this.workerId = workerId;
        this.settings = settings;
        this.sessionStore = sessionStore;
        this.taskQueue = taskQueue;
        this.executor = executor;
        this.writer = writer;
        this.auditLogger = auditLogger;
        this.watchdog = Executors.newSingleThreadScheduledExecutor(daemon(workerId + "-watchdog"));
        this.runner = newRunner();
    }

    public String workerId() {
        return workerId;
    }

    public WorkerOutcome runOnce() {
        taskQueue.promoteDueRetries(Instant.now().toEpochMilli(), settings.retryPromoteLimit());
        Optional<TaskQueue.ClaimedTask> maybe = taskQueue.claimNext(workerId);
        if (maybe.isEmpty()) {
            return WorkerOutcome.idle();
        }
        TaskQueue.ClaimedTask claimed = maybe.get();
        // The claim is refreshed for the whole delivery, append included, so only a dead worker's claim goes stale.
        ScheduledFuture<?> heartbeat = watchdog.scheduleAtFixedRate(
                () -> refreshClaim(claimed), settings.claimHeartbeatMs(), settings.claimHeartbeatMs(), TimeUnit.MILLISECONDS
        );
        try {
            return handle(claimed);
        } finally {
            heartbeat.cancel(false);
        }
    }

    private WorkerOutcome handle(TaskQueue.ClaimedTask claimed) {
        TaskDescriptor task = claimed.descriptor();

        Optional<TaskView> current = sessionStore.getTask(task.taskId());
        if (current.isEmpty()) {
            taskQueue.deadLetter(claimed);
            logger.warn("Dead-lettered delivery for unknown task {}", task.taskId());
            return WorkerOutcome.of(Disposition.DEAD_LETTERED, task, "Task not found");
        }
        if (!startProcessing(task, current.get())) {
            taskQueue.acknowledge(claimed);
            return WorkerOutcome.of(Disposition.SKIPPED, task, "Task already finished");
        }
        auditLogger.log(AuditLogger.AuditEvent.forTask(
                "task.claimed", workerId, task.sessionId(), task.taskId(), "processing",
                Map.of("retry_count", task.retryCount(), "remainder", task.remainder())
        ));

        TaskExecutionResult result;
        try {
            result = runWithLimits(task);
        } catch (TaskExecutionException e) {
            return handleFailure(claimed, e.getMessage());
        }

        AppendResult append = writer.append(result.rows(), result.batchId());
        boolean appendDropped = false;
        if (!append.committed()) {
            if (!settings.dropBatchOnAppendFailure()) {
                return handleFailure(claimed, "append failed for batch " + result.batchId() + ": " + append.error());
            }
            appendDropped = true;
            logger.error("Dropping batch {} after append failure: {}", result.batchId(), append.error());
            auditLogger.log(AuditLogger.AuditEvent.forTask(
                    "append.failed", workerId, task.sessionId(), task.taskId(), "dropped",
                    Map.of("batch_id", result.batchId(), "attempts", append.attempts().size(), "error", String.valueOf(append.error()))
            ));
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("batch_id", result.batchId());
        summary.put("attempted", result.attempted());
        summary.put("succeeded", result.succeeded());
        summary.put("failed", result.failed());
        summary.put("rows_written", append.rowsWritten());
        summary.put("append_attempts", append.attempts().size());
        summary.put("append_failed", appendDropped);
        try {
            sessionStore.transitionTask(
                    task.taskId(), TaskStatus.COMPLETED, workerId, Jsons.toCompactJson(summary), null, Instant.now().toEpochMilli()
            );
        } catch (TaskTransitionException e) {
            return settleRace(claimed, e);
        }
        boolean sessionDone = sessionStore.tryCompleteSession(task.sessionId(), Instant.now().toEpochMilli());
        taskQueue.acknowledge(claimed);
        auditLogger.log(AuditLogger.AuditEvent.forTask("task.completed", workerId, task.sessionId(), task.taskId(), "completed", summary));
        if (sessionDone) {
            logSessionCompleted(task.sessionId());
        }
        return WorkerOutcome.of(Disposition.COMPLETED, task, "Task completed: " + result.succeeded() + "/" + result.attempted() + " succeeded");
    }

    /**
     * Moves the task into PROCESSING for this delivery, or re-stamps it when a previous delivery
     * already did. Returns false when the task is terminal and the delivery should only be acked.
     */
    private boolean startProcessing(TaskDescriptor task, TaskView current) {
        long now = Instant.now().toEpochMilli();
        TaskStatus status = current.taskStatus();
        if (status.isTerminal()) {
            return false;
        }
        if (status == TaskStatus.PENDING) {
            try {
                sessionStore.transitionTask(task.taskId(), TaskStatus.PROCESSING, workerId, now);
                if (task.retryCount() > 0) {
                    sessionStore.recordRedelivery(task.taskId(), workerId, task.retryCount(), now);
                }
                return true;
            } catch (TaskTransitionException raced) {
                // Another delivery moved it first; fall through and look again.
            }
        }
        if (sessionStore.recordRedelivery(task.taskId(), workerId, task.retryCount(), now)) {
            logger.info("Task {} redelivered to {} (retry {})", task.taskId(), workerId, task.retryCount());
            return true;
        }
        return false;
    }

    private void refreshClaim(TaskQueue.ClaimedTask claimed) {
        try {
            if (!taskQueue.heartbeat(claimed)) {
                logger.warn("Claim on task {} is gone from {}", claimed.descriptor().taskId(), workerId);
            }
        } catch (RuntimeException e) {
            // An exception would cancel the periodic refresh; the next tick tries again.
            logger.warn("Failed to refresh claim on task {}", claimed.descriptor().taskId(), e);
        }
    }

    private TaskExecutionResult runWithLimits(TaskDescriptor task) throws TaskExecutionException {
        ScheduledFuture<?> softWarning = watchdog.schedule(
                () -> warnSoftLimit(task), settings.taskSoftLimitMs(), TimeUnit.MILLISECONDS
        );
        Future<TaskExecutionResult> future = runner.submit(() -> executor.execute(task));
        try {
            return future.get(settings.taskHardLimitMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            // The stuck thread may ignore interruption; never reuse it.
            runner.shutdownNow();
            runner = newRunner();
            throw new TaskExecutionException(task.taskId(), "hard time limit exceeded after " + settings.taskHardLimitMs() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TaskExecutionException taskError) {
                throw taskError;
            }
            throw new TaskExecutionException(task.taskId(), "task crashed: " + cause, cause);
        } catch (CancellationException e) {
            throw new TaskExecutionException(task.taskId(), "task cancelled", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TaskExecutionException(task.taskId(), "worker interrupted", e);
        } finally {
            softWarning.cancel(false);
        }
    }

    private void warnSoftLimit(TaskDescriptor task) {
        logger.warn("Task {} exceeded soft time limit of {} ms on {}", task.taskId(), settings.taskSoftLimitMs(), workerId);
        auditLogger.log(AuditLogger.AuditEvent.forTask(
                "task.soft_limit", workerId, task.sessionId(), task.taskId(), "warning",
                Map.of("soft_limit_ms", settings.taskSoftLimitMs())
        ));
    }

    /**
     * Task-level failure: reschedules with backoff while retries remain, otherwise records FAILED.
     * The task stays PROCESSING while a retry is pending.
     */
    private WorkerOutcome handleFailure(TaskQueue.ClaimedTask claimed, String error) {
        TaskDescriptor task = claimed.descriptor();
        long now = Instant.now().toEpochMilli();
        if (task.retryCount() < settings.maxRetries()) {
            long delayMs = settings.retryDelayMs(task.retryCount());
            TaskDescriptor next = task.withRetryCount(task.retryCount() + 1);
            sessionStore.recordTaskError(task.taskId(), error, now);
            taskQueue.scheduleRetry(claimed, next, now + delayMs);
            logger.warn("Task {} failed (retry {}/{} in {} ms): {}",
                    task.taskId(), next.retryCount(), settings.maxRetries(), delayMs, error);
            auditLogger.log(AuditLogger.AuditEvent.forTask(
                    "task.retry", workerId, task.sessionId(), task.taskId(), "scheduled",
                    Map.of("retry_count", next.retryCount(), "delay_ms", delayMs, "error", error)
            ));
            return WorkerOutcome.of(Disposition.RETRY_SCHEDULED, task, "Retry scheduled: " + error);
        }

        try {
            sessionStore.transitionTask(task.taskId(), TaskStatus.FAILED, workerId, null, error, now);
        } catch (TaskTransitionException e) {
            return settleRace(claimed, e);
        }
        boolean sessionDone = sessionStore.tryCompleteSession(task.sessionId(), Instant.now().toEpochMilli());
        taskQueue.acknowledge(claimed);
        logger.error("Task {} failed after {} retries: {}", task.taskId(), task.retryCount(), error);
        auditLogger.log(AuditLogger.AuditEvent.forTask(
                "task.failed", workerId, task.sessionId(), task.taskId(), "failed",
                Map.of("retry_count", task.retryCount(), "error", error)
        ));
        if (sessionDone) {
            logSessionCompleted(task.sessionId());
        }
        return WorkerOutcome.of(Disposition.FAILED, task, "Task failed: " + error);
    }

    /**
     * A concurrent delivery of the same task reached a terminal status first.
     */
    private WorkerOutcome settleRace(TaskQueue.ClaimedTask claimed, TaskTransitionException e) {
        TaskDescriptor task = claimed.descriptor();
        Optional<TaskView> latest = sessionStore.getTask(task.taskId());
        if (latest.isPresent() && latest.get().taskStatus().isTerminal()) {
            taskQueue.acknowledge(claimed);
            logger.info("Task {} finished by another delivery; acknowledging", task.taskId());
            return WorkerOutcome.of(Disposition.SKIPPED, task, "Task already finished");
        }
        throw e;
    }

    private void logSessionCompleted(String sessionId) {
        logger.info("Session {} completed", sessionId);
        auditLogger.log(AuditLogger.AuditEvent.of("session.completed", workerId, "session/" + sessionId, "completed", Map.of()));
    }

    private ExecutorService newRunner() {
        return Executors.newSingleThreadExecutor(daemon(workerId + "-runner"));
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, "querymesh-" + name);
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        watchdog.shutdownNow();
        runner.shutdownNow();
    }

    public enum Disposition {
        IDLE,
        COMPLETED,
        RETRY_SCHEDULED,
        FAILED,
        SKIPPED,
        DEAD_LETTERED
    }

    public record WorkerOutcome(boolean processed, Disposition disposition, String taskId, String sessionId, String message) {
        static WorkerOutcome idle() {
            return new WorkerOutcome(false, Disposition.IDLE, null, null, "No queued tasks");
        }

        static WorkerOutcome of(Disposition disposition, TaskDescriptor task, String message) {
            return new WorkerOutcome(true, disposition, task.taskId(), task.sessionId(), message);
        }
    }
}
