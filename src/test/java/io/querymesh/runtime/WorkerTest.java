package io.querymesh.runtime;

import io.querymesh.bus.TaskQueue;
import io.querymesh.config.QueryMeshConfig;
import io.querymesh.config.QueryMeshSettings;
import io.querymesh.lock.LockGuard;
import io.querymesh.model.SessionStatus;
import io.querymesh.model.TaskDescriptor;
import io.querymesh.model.TaskStatus;
import io.querymesh.model.TaskView;
import io.querymesh.source.JsonLinesQueryFileReader;
import io.querymesh.table.ResultSummary;
import io.querymesh.table.SharedTableWriter;
import io.querymesh.transpile.TranspileException;
import io.querymesh.transpile.TranspileRequest;
import io.querymesh.transpile.TranspileResult;
import io.querymesh.transpile.Transpiler;
import io.querymesh.transpile.TranspilerUnavailableException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

final class WorkerTest {

    @Test
    void transientFailuresAreRetriedUntilTheTaskCompletes() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-worker-retry-");
        try {
            QueryMeshRuntime runtime = runtime(root, "{\"maxRetries\":3,\"retryBaseDelayMs\":0}");
            Dispatcher.DispatchOutcome outcome = dispatchOneShard(runtime, root);
            TaskView task = onlyTask(runtime, outcome.sessionId());

            try (Worker worker = worker(runtime, new FlakyTranspiler(2))) {
                Assertions.assertEquals(Worker.Disposition.RETRY_SCHEDULED, worker.runOnce().disposition());
                Assertions.assertEquals(Worker.Disposition.RETRY_SCHEDULED, worker.runOnce().disposition());
                Worker.WorkerOutcome done = worker.runOnce();
                Assertions.assertEquals(Worker.Disposition.COMPLETED, done.disposition());
                Assertions.assertEquals(task.taskId(), done.taskId());
                Assertions.assertFalse(worker.runOnce().processed());
            }

            TaskView finished = runtime.sessionStore().getTask(task.taskId()).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, finished.taskStatus());
            Assertions.assertEquals(2, finished.retryCount());
            Assertions.assertTrue(finished.resultPayload().contains("\"rows_written\":3"));
            Assertions.assertEquals(
                    SessionStatus.COMPLETED,
                    runtime.sessionStore().getSession(outcome.sessionId()).orElseThrow().sessionStatus()
            );
            Assertions.assertEquals(3, runtime.newResultTable().countRows(outcome.sessionId()));
            Assertions.assertTrue(runtime.taskQueue().depth().drained());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exhaustedRetriesMarkTheTaskFailedAndStillFinishTheSession() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-worker-exhausted-");
        try {
            QueryMeshRuntime runtime = runtime(root, "{\"maxRetries\":2,\"retryBaseDelayMs\":0}");
            Dispatcher.DispatchOutcome outcome = dispatchOneShard(runtime, root);
            TaskView task = onlyTask(runtime, outcome.sessionId());

            try (Worker worker = worker(runtime, new FlakyTranspiler(Integer.MAX_VALUE))) {
                Assertions.assertEquals(Worker.Disposition.RETRY_SCHEDULED, worker.runOnce().disposition());
                TaskView retrying = runtime.sessionStore().getTask(task.taskId()).orElseThrow();
                Assertions.assertEquals(TaskStatus.PROCESSING, retrying.taskStatus());
                Assertions.assertTrue(retrying.lastError().contains("connection refused"));

                Assertions.assertEquals(Worker.Disposition.RETRY_SCHEDULED, worker.runOnce().disposition());
                Assertions.assertEquals(Worker.Disposition.FAILED, worker.runOnce().disposition());
            }

            TaskView failed = runtime.sessionStore().getTask(task.taskId()).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, failed.taskStatus());
            Assertions.assertEquals(2, failed.retryCount());
            Assertions.assertNotNull(failed.finishedAtMs());

            var status = runtime.sessionStatus(outcome.sessionId()).orElseThrow();
            Assertions.assertEquals("completed", status.status());
            Assertions.assertEquals(1, status.progress().failed());
            Assertions.assertEquals(100.0, status.progress().completionPercentage());
            Assertions.assertEquals(0, runtime.newResultTable().countRows(outcome.sessionId()));
            Assertions.assertEquals(new TaskQueue.QueueDepth(0, 0, 0, 0), runtime.taskQueue().depth());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void redeliveryOfAFinishedTaskIsOnlyAcknowledged() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-worker-redelivery-");
        try {
            QueryMeshRuntime runtime = runtime(root, "{}");
            Dispatcher.DispatchOutcome outcome = dispatchOneShard(runtime, root);
            TaskView task = onlyTask(runtime, outcome.sessionId());

            try (Worker worker = worker(runtime, new FlakyTranspiler(0))) {
                Assertions.assertEquals(Worker.Disposition.COMPLETED, worker.runOnce().disposition());

                runtime.taskQueue().enqueue(descriptorFor(task, outcome, 1));
                Worker.WorkerOutcome duplicate = worker.runOnce();
                Assertions.assertEquals(Worker.Disposition.SKIPPED, duplicate.disposition());
            }

            Assertions.assertEquals(3, runtime.newResultTable().countRows(outcome.sessionId()));
            Assertions.assertEquals(0, runtime.sessionStore().getTask(task.taskId()).orElseThrow().retryCount());
            Assertions.assertTrue(runtime.taskQueue().depth().drained());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deliveryForAnUnknownTaskIsDeadLettered() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-worker-unknown-");
        try {
            QueryMeshRuntime runtime = runtime(root, "{}");
            runtime.taskQueue().enqueue(new TaskDescriptor(
                    "tsk_ghost", "ses_ghost", root.resolve("none.jsonl").toString(), 0, 1, "query", "hive", "trino",
                    0, Map.of(), Map.of(), 0, Instant.now().toEpochMilli()
            ));

            try (Worker worker = worker(runtime, new FlakyTranspiler(0))) {
                Assertions.assertEquals(Worker.Disposition.DEAD_LETTERED, worker.runOnce().disposition());
            }
            Assertions.assertEquals(new TaskQueue.QueueDepth(0, 0, 0, 1), runtime.taskQueue().depth());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void hardTimeLimitFailsTheTask() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-worker-hard-limit-");
        try {
            QueryMeshRuntime runtime = runtime(root, "{\"maxRetries\":0,\"taskSoftLimitMs\":50,\"taskHardLimitMs\":200}");
            Dispatcher.DispatchOutcome outcome = dispatchOneShard(runtime, root);
            TaskView task = onlyTask(runtime, outcome.sessionId());

            Transpiler stuck = new Transpiler() {
                @Override
                public String id() {
                    return "stuck";
                }

                @Override
                public TranspileResult transpile(TranspileRequest request) throws TranspileException {
                    try {
                        Thread.sleep(10_000L);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new TranspileException("interrupted");
                    }
                    return TranspileResult.executable(request.query(), List.of(), List.of());
                }
            };
            try (Worker worker = worker(runtime, stuck)) {
                Assertions.assertEquals(Worker.Disposition.FAILED, worker.runOnce().disposition());
            }

            TaskView failed = runtime.sessionStore().getTask(task.taskId()).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, failed.taskStatus());
            Assertions.assertTrue(failed.lastError().contains("hard time limit"));
            String audit = Files.readString(runtime.config().auditFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(audit.contains("task.soft_limit"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void claimStaysFreshWhileTheAppendWaitsForTheBatchLock() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-worker-heartbeat-");
        try {
            QueryMeshRuntime runtime = runtime(root, "{\"maxRetries\":0,\"taskSoftLimitMs\":100,\"taskHardLimitMs\":300,"
                    + "\"reclaimAfterMs\":300,\"lockTimeoutMs\":3000,\"appendMaxAttempts\":1}");
            Dispatcher.DispatchOutcome outcome = dispatchOneShard(runtime, root);
            TaskView task = onlyTask(runtime, outcome.sessionId());
            String lockName = SharedTableWriter.LOCK_PREFIX + outcome.sessionId() + "_queries_batch_0";

            LockGuard held = runtime.lock().acquire(lockName, Duration.ofSeconds(10));
            ExecutorService background = Executors.newSingleThreadExecutor();
            try (Worker worker = worker(runtime, new FlakyTranspiler(0))) {
                Future<Worker.WorkerOutcome> running = background.submit(worker::runOnce);
                int reclaimed = 0;
                long sweepUntil = System.currentTimeMillis() + 1_200L;
                while (System.currentTimeMillis() < sweepUntil) {
                    reclaimed += runtime.taskQueue().reclaimStale(300L);
                    Thread.sleep(50L);
                }
                Assertions.assertFalse(running.isDone());
                Assertions.assertEquals(0, reclaimed);

                runtime.lock().release(held);
                Assertions.assertEquals(Worker.Disposition.COMPLETED, running.get(10, TimeUnit.SECONDS).disposition());
            } finally {
                background.shutdownNow();
            }

            Assertions.assertEquals(TaskStatus.COMPLETED, runtime.sessionStore().getTask(task.taskId()).orElseThrow().taskStatus());
            Assertions.assertEquals(3, runtime.newResultTable().countRows(outcome.sessionId()));
            Assertions.assertEquals(new TaskQueue.QueueDepth(0, 0, 0, 0), runtime.taskQueue().depth());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void poolDrainsEverySessionShard() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-worker-pool-");
        try {
            QueryMeshRuntime runtime = runtime(root, "{\"workerPollIntervalMs\":20}");
            Path input = Files.createDirectories(root.resolve("input"));
            DispatcherTest.writeQueries(input.resolve("first.jsonl"), 60, 40);
            DispatcherTest.writeQueries(input.resolve("second.jsonl"), 25, 25);
            Dispatcher.DispatchOutcome outcome = runtime.dispatch(new Dispatcher.DispatchRequest(
                    input, "hive", "trino", "query", Map.of(), Map.of(), 10
            ));
            Assertions.assertEquals(6, outcome.totalShards());

            try (WorkerPool pool = new WorkerPool(runtime, 3, "pool-test")) {
                pool.start();
                Assertions.assertTrue(pool.drainUntilIdle(Duration.ofSeconds(60)));
                Assertions.assertEquals(6, pool.processedCount());
            }

            var status = runtime.sessionStatus(outcome.sessionId()).orElseThrow();
            Assertions.assertEquals("completed", status.status());
            Assertions.assertEquals(6, status.progress().completed());
            Assertions.assertTrue(runtime.sessionStore().verifyProgress(outcome.sessionId()).consistent());

            ResultSummary summary = runtime.results(outcome.sessionId());
            Assertions.assertEquals(65, summary.totalRows());
            Assertions.assertEquals(65, summary.distinctQueries());
        } finally {
            deleteRecursively(root);
        }
    }

    private static QueryMeshRuntime runtime(Path root, String settingsJson) throws IOException {
        Path settingsFile = root.resolve("settings.json");
        Files.writeString(settingsFile, settingsJson, StandardCharsets.UTF_8);
        QueryMeshRuntime runtime = new QueryMeshRuntime(
                QueryMeshConfig.fromRoot(root.resolve("data").toString()),
                QueryMeshSettings.load(settingsFile)
        );
        runtime.init();
        return runtime;
    }

    private static Dispatcher.DispatchOutcome dispatchOneShard(QueryMeshRuntime runtime, Path root) throws IOException {
        Path file = root.resolve("queries.jsonl");
        DispatcherTest.writeQueries(file, 5, 3);
        return runtime.dispatch(new Dispatcher.DispatchRequest(file, "hive", "trino", "query", Map.of(), Map.of(), 100));
    }

    private static TaskView onlyTask(QueryMeshRuntime runtime, String sessionId) {
        List<TaskView> tasks = runtime.sessionStore().listSessionTasks(sessionId, null);
        Assertions.assertEquals(1, tasks.size());
        return tasks.get(0);
    }

    private static TaskDescriptor descriptorFor(TaskView task, Dispatcher.DispatchOutcome outcome, int retryCount) {
        return new TaskDescriptor(
                task.taskId(), outcome.sessionId(), task.filePath(), task.remainder(), task.totalShards(), "query",
                "hive", "trino", task.estimatedUniqueCount(), Map.of(), Map.of(), retryCount, Instant.now().toEpochMilli()
        );
    }

    private static Worker worker(QueryMeshRuntime runtime, Transpiler transpiler) {
        return new Worker(
                "w-test",
                runtime.settings(),
                runtime.sessionStore(),
                runtime.taskQueue(),
                new TaskExecutor(new JsonLinesQueryFileReader(), transpiler),
                runtime.newWriter(),
                runtime.auditLogger()
        );
    }

    /**
     * Unreachable for the first {@code failures} calls, then converts queries unchanged.
     */
    static final class FlakyTranspiler implements Transpiler {
        private final int failures;
        private final AtomicInteger calls = new AtomicInteger();

        FlakyTranspiler(int failures) {
            this.failures = failures;
        }

        @Override
        public String id() {
            return "flaky";
        }

        @Override
        public TranspileResult transpile(TranspileRequest request) {
            if (calls.getAndIncrement() < failures) {
                throw new TranspilerUnavailableException("connection refused");
            }
            return TranspileResult.executable(request.query(), List.of(), List.of("t"));
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
