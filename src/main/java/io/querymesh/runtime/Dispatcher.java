package io.querymesh.runtime;

import io.querymesh.bus.TaskQueue;
import io.querymesh.model.FileStats;
import io.querymesh.model.TaskDescriptor;
import io.querymesh.observability.AuditLogger;
import io.querymesh.partition.HashPartitioner;
import io.querymesh.source.InputFiles;
import io.querymesh.source.QueryFileReader;
import io.querymesh.storage.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Turns an input location into a session: pre-scans every file, fixes the shard layout, records
 * the session with all of its pending tasks, then enqueues one descriptor per task.
 */
public final class Dispatcher {
    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);
    static final long ESTIMATED_QUERIES_PER_SECOND = 500L;

    private final SessionStore sessionStore;
    private final TaskQueue taskQueue;
    private final QueryFileReader reader;
    private final AuditLogger auditLogger;
    private final int defaultTargetShardSize;

    public Dispatcher(
            SessionStore sessionStore,
            TaskQueue taskQueue,
            QueryFileReader reader,
            AuditLogger auditLogger,
            int defaultTargetShardSize
    ) {
        this.sessionStore = sessionStore;
        this.taskQueue = taskQueue;
        this.reader = reader;
        this.auditLogger = auditLogger;
        this.defaultTargetShardSize = defaultTargetShardSize;
    }

    /**
     * @throws IOException if the source path does not exist or cannot be listed
     * @throws IllegalArgumentException if no input file could be read
     */
    public DispatchOutcome dispatch(DispatchRequest request) throws IOException {
        int targetShardSize = request.targetShardSize() > 0 ? request.targetShardSize() : defaultTargetShardSize;
        List<Path> files = InputFiles.discover(request.sourcePath(), reader);
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No input files found under " + request.sourcePath());
        }

        List<FileStats> fileStats = new ArrayList<>(files.size());
        for (Path file : files) {
            fileStats.add(preScan(file, request, targetShardSize));
        }
        if (fileStats.stream().noneMatch(FileStats::readable)) {
            throw new IllegalArgumentException("No readable input files under " + request.sourcePath());
        }

        long now = Instant.now().toEpochMilli();
        String sessionId = "ses_" + UUID.randomUUID();
        List<SessionStore.TaskSpec> tasks = new ArrayList<>();
        long totalQueries = 0L;
        long uniqueQueries = 0L;
        for (FileStats stats : fileStats) {
            totalQueries += stats.totalQueries();
            uniqueQueries += stats.uniqueQueries();
            for (int remainder = 0; remainder < stats.shards(); remainder++) {
                tasks.add(new SessionStore.TaskSpec(
                        "tsk_" + UUID.randomUUID(),
                        stats.filePath(),
                        remainder,
                        stats.shards(),
                        stats.queriesPerShard()
                ));
            }
        }

        sessionStore.createSessionWithTasks(
                new SessionStore.SessionSpec(
                        sessionId,
                        request.sourcePath().toString(),
                        request.fromDialect(),
                        request.toDialect(),
                        request.queryColumn(),
                        files.size(),
                        totalQueries,
                        uniqueQueries,
                        tasks.size(),
                        fileStats,
                        now
                ),
                tasks
        );
        auditLogger.log(AuditLogger.AuditEvent.of(
                "session.created",
                "dispatcher",
                "session/" + sessionId,
                "processing",
                Map.of("total_files", files.size(), "total_shards", tasks.size(), "unique_queries", uniqueQueries)
        ));

        int queued = 0;
        try {
            for (SessionStore.TaskSpec task : tasks) {
                taskQueue.enqueue(new TaskDescriptor(
                        task.taskId(),
                        sessionId,
                        task.filePath(),
                        task.remainder(),
                        task.totalShards(),
                        request.queryColumn(),
                        request.fromDialect(),
                        request.toDialect(),
                        task.estimatedUniqueCount(),
                        request.featureFlags(),
                        request.filters(),
                        0,
                        now
                ));
                queued++;
            }
        } catch (RuntimeException e) {
            String error = "dispatch aborted after " + queued + "/" + tasks.size() + " tasks: " + e.getMessage();
            sessionStore.failSession(sessionId, error, Instant.now().toEpochMilli());
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "session.dispatch",
                    "dispatcher",
                    "session/" + sessionId,
                    "failed",
                    Map.of("queued", queued, "error", String.valueOf(e.getMessage()))
            ));
            throw e;
        }

        long estimatedSeconds = uniqueQueries / ESTIMATED_QUERIES_PER_SECOND;
        logger.info("Dispatched session {}: {} files, {} unique queries, {} shards",
                sessionId, files.size(), uniqueQueries, tasks.size());
        return new DispatchOutcome(
                sessionId,
                files.size(),
                totalQueries,
                uniqueQueries,
                tasks.size(),
                queued,
                estimatedSeconds,
                fileStats
        );
    }

    private FileStats preScan(Path file, DispatchRequest request, int targetShardSize) {
        String filePath = file.toString();
        long[] total = {0L};
        Set<String> unique = new HashSet<>();
        try {
            reader.read(file, request.queryColumn(), row -> {
                if (!row.hasQuery() || !row.matches(request.filters())) {
                    return;
                }
                total[0]++;
                unique.add(row.query().strip());
            });
        } catch (IOException | RuntimeException e) {
            logger.warn("Skipping unreadable input file {}: {}", filePath, e.getMessage());
            return FileStats.unreadable(filePath, String.valueOf(e.getMessage()));
        }
        int shards = HashPartitioner.shardCountFor(unique.size(), targetShardSize);
        return FileStats.scanned(filePath, total[0], unique.size(), shards);
    }

    public record DispatchRequest(
            Path sourcePath,
            String fromDialect,
            String toDialect,
            String queryColumn,
            Map<String, String> filters,
            Map<String, Object> featureFlags,
            int targetShardSize
    ) {
        public DispatchRequest {
            if (sourcePath == null) {
                throw new IllegalArgumentException("source path is required");
            }
            if (fromDialect == null || fromDialect.isBlank() || toDialect == null || toDialect.isBlank()) {
                throw new IllegalArgumentException("from and to dialects are required");
            }
            if (queryColumn == null || queryColumn.isBlank()) {
                throw new IllegalArgumentException("query column is required");
            }
            filters = filters == null ? Map.of() : new LinkedHashMap<>(filters);
            featureFlags = featureFlags == null ? Map.of() : new LinkedHashMap<>(featureFlags);
        }
    }

    public record DispatchOutcome(
            String sessionId,
            int totalFiles,
            long totalQueries,
            long uniqueQueries,
            int totalShards,
            int tasksQueued,
            long estimatedProcessingSeconds,
            List<FileStats> fileStats
    ) {
    }
}
