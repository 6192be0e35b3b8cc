package io.querymesh.cli;

import io.querymesh.config.QueryMeshConfig;
import io.querymesh.model.SessionStatus;
import io.querymesh.model.SessionStatusView;
import io.querymesh.model.TaskStatus;
import io.querymesh.model.TaskView;
import io.querymesh.runtime.Dispatcher;
import io.querymesh.runtime.QueryMeshRuntime;
import io.querymesh.runtime.Worker;
import io.querymesh.runtime.WorkerPool;
import io.querymesh.storage.SessionStore;
import io.querymesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "querymesh",
        mixinStandardHelpOptions = true,
        description = "QueryMesh distributed query conversion CLI",
        subcommands = {
                QueryMeshCommand.InitCommand.class,
                QueryMeshCommand.DispatchCommand.class,
                QueryMeshCommand.WorkerCommand.class,
                QueryMeshCommand.SessionCommand.class,
                QueryMeshCommand.SessionsCommand.class,
                QueryMeshCommand.TasksCommand.class,
                QueryMeshCommand.TaskCommand.class,
                QueryMeshCommand.ResultsCommand.class,
                QueryMeshCommand.ReclaimCommand.class,
                QueryMeshCommand.PurgeCommand.class,
                QueryMeshCommand.VerifyCommand.class
        }
)
public final class QueryMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Runtime namespace (tenant scope)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | dispatch | worker | session | sessions | tasks | task | results | reclaim | purge | verify");
    }

    QueryMeshRuntime runtime() {
        QueryMeshConfig config = QueryMeshConfig.fromRoot(root, namespace);
        return new QueryMeshRuntime(config);
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        QueryMeshCommand parent;

        @Override
        public Integer call() {
            QueryMeshRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println("Initialized QueryMesh at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "dispatch", description = "Pre-scan input files, create a session and queue its tasks")
    static final class DispatchCommand implements Callable<Integer> {
        @ParentCommand
        QueryMeshCommand parent;

        @Option(names = {"--source"}, required = true, description = "Input file or directory of .jsonl files")
        String source;

        @Option(names = {"--from"}, required = true, description = "Source SQL dialect")
        String fromDialect;

        @Option(names = {"--to"}, required = true, description = "Target SQL dialect")
        String toDialect;

        @Option(names = {"--query-column"}, defaultValue = "query", description = "Column holding the query text")
        String queryColumn;

        @Option(names = {"--filter"}, description = "Keep only rows whose column equals the value (column=value)")
        Map<String, String> filters;

        @Option(names = {"--flag"}, description = "Feature flag passed to the transpiler (name=value)")
        Map<String, String> flags;

        @Option(names = {"--shard-size"}, defaultValue = "0",
                description = "Target distinct queries per shard; 0 uses the configured value")
        int shardSize;

        @Override
        public Integer call() throws Exception {
            QueryMeshRuntime runtime = parent.runtime();
            runtime.init();
            Dispatcher.DispatchOutcome outcome = runtime.dispatch(new Dispatcher.DispatchRequest(
                    Path.of(source),
                    fromDialect,
                    toDialect,
                    queryColumn,
                    filters,
                    parseFlags(flags),
                    shardSize
            ));
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "worker", description = "Run a worker pool, or a single poll with --once")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        QueryMeshCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Handle at most one delivery and exit")
        boolean once;

        @Option(names = {"--worker-id"}, defaultValue = "worker-local", description = "Worker identity (pool prefix)")
        String workerId;

        @Option(names = {"--workers"}, defaultValue = "0", description = "Worker threads; 0 uses the configured count")
        int workers;

        @Option(names = {"--drain"}, defaultValue = "false", description = "Exit once the queue is empty")
        boolean drain;

        @Option(names = {"--drain-timeout-ms"}, defaultValue = "3600000", description = "Max wait for --drain")
        long drainTimeoutMs;

        @Override
        public Integer call() throws Exception {
            QueryMeshRuntime runtime = parent.runtime();
            runtime.init();
            if (once) {
                try (Worker worker = runtime.newWorker(workerId)) {
                    Worker.WorkerOutcome result = worker.runOnce();
                    System.out.println(Jsons.toJson(result));
                }
                return 0;
            }
            int count = workers > 0 ? workers : runtime.settings().workerCount();
            WorkerPool pool = new WorkerPool(runtime, count, workerId);
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                pool.close();
                stopped.countDown();
            }, "querymesh-shutdown-hook"));
            pool.start();
            if (drain) {
                boolean idle = pool.drainUntilIdle(Duration.ofMillis(drainTimeoutMs));
                pool.close();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("drained", idle);
                out.put("processed", pool.processedCount());
                out.put("queue", runtime.taskQueue().depth());
                System.out.println(Jsons.toJson(out));
                return idle ? 0 : 1;
            }
            stopped.await();
            return 0;
        }
    }

    @Command(name = "session", description = "Show session progress by session id")
    static final class SessionCommand implements Callable<Integer> {
        @ParentCommand
        QueryMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--details"}, defaultValue = "false", description = "Print the full session record")
        boolean details;

        @Override
        public Integer call() {
            QueryMeshRuntime runtime = parent.runtime();
            runtime.init();
            if (details) {
                var session = runtime.sessionStore().getSession(sessionId);
                if (session.isEmpty()) {
                    System.out.println("{\"error\":\"session not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(session.get()));
                return 0;
            }
            Optional<SessionStatusView> status = runtime.sessionStatus(sessionId);
            if (status.isEmpty()) {
                System.out.println("{\"error\":\"session not found\"}");
                return 1;
            }
            System.out.println(Jsons.toJson(status.get()));
            return 0;
        }
    }

    @Command(name = "sessions", description = "List sessions, newest first")
    static final class SessionsCommand implements Callable<Integer> {
        @ParentCommand
        QueryMeshCommand parent;

        @Option(names = {"--status"}, description = "Filter by session status: processing|completed|failed")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            QueryMeshRuntime runtime = parent.runtime();
            runtime.init();
            SessionStatus filter = status == null ? null : SessionStatus.fromString(status);
            System.out.println(Jsons.toJson(runtime.sessionStore().listSessions(filter, limit)));
            return 0;
        }
    }

    @Command(name = "tasks", description = "List the tasks of a session")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        QueryMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--status"}, description = "Filter by task status")
        String status;

        @Override
        public Integer call() {
            QueryMeshRuntime runtime = parent.runtime();
            runtime.init();
            TaskStatus filter = status == null ? null : TaskStatus.fromString(status);
            System.out.println(Jsons.toJson(runtime.sessionStore().listSessionTasks(sessionId, filter)));
            return 0;
        }
    }

    @Command(name = "task", description = "Query task status by task id")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        QueryMeshCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            QueryMeshRuntime runtime = parent.runtime();
            runtime.init();
            Optional<TaskView> task = runtime.sessionStore().getTask(taskId);
            if (task.isEmpty()) {
                System.out.println("{\"error\":\"task not found\"}");
                return 1;
            }
            System.out.println(Jsons.toJson(task.get()));
            return 0;
        }
    }

    @Command(name = "results", description = "Summarize the result rows of a session")
    static final class ResultsCommand implements Callable<Integer> {
        @ParentCommand
        QueryMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            QueryMeshRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.results(sessionId)));
            return 0;
        }
    }

    @Command(name = "reclaim", description = "Return unacknowledged deliveries to the inbox")
    static final class ReclaimCommand implements Callable<Integer> {
        @ParentCommand
        QueryMeshCommand parent;

        @Option(names = {"--older-than-ms"}, defaultValue = "-1",
                description = "Claim age threshold; negative uses the configured reclaim age")
        long olderThanMs;

        @Override
        public Integer call() {
            QueryMeshRuntime runtime = parent.runtime();
            runtime.init();
            long threshold = olderThanMs >= 0 ? olderThanMs : runtime.settings().reclaimAfterMs();
            int reclaimed = runtime.reclaimStale(threshold);
            System.out.println(Jsons.toJson(Map.of("reclaimed", reclaimed, "older_than_ms", threshold)));
            return 0;
        }
    }

    @Command(name = "purge", description = "Delete finished sessions older than the retention window")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        QueryMeshCommand parent;

        @Option(names = {"--retention-hours"}, defaultValue = "-1",
                description = "Keep sessions newer than this; negative uses the configured retention")
        long retentionHours;

        @Override
        public Integer call() {
            QueryMeshRuntime runtime = parent.runtime();
            runtime.init();
            long hours = retentionHours >= 0 ? retentionHours : runtime.settings().sessionRetentionHours();
            SessionStore.PurgeSummary summary = runtime.purgeSessions(Duration.ofHours(hours));
            System.out.println(Jsons.toJson(summary));
            return 0;
        }
    }

    @Command(name = "verify", description = "Check that a session's counters match its task membership")
    static final class VerifyCommand implements Callable<Integer> {
        @ParentCommand
        QueryMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            QueryMeshRuntime runtime = parent.runtime();
            runtime.init();
            SessionStore.ProgressCheck check = runtime.sessionStore().verifyProgress(sessionId);
            System.out.println(Jsons.toJson(check));
            return check.consistent() ? 0 : 1;
        }
    }

    static Map<String, Object> parseFlags(Map<String, String> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (raw == null) {
            return out;
        }
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            String value = entry.getValue() == null ? "" : entry.getValue().trim();
            String lower = value.toLowerCase(Locale.ROOT);
            if ("true".equals(lower) || "false".equals(lower)) {
                out.put(entry.getKey(), Boolean.parseBoolean(lower));
            } else {
                out.put(entry.getKey(), value);
            }
        }
        return out;
    }
}
