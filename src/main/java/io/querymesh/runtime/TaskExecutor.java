package io.querymesh.runtime;

import io.querymesh.model.ResultRow;
import io.querymesh.model.TaskDescriptor;
import io.querymesh.partition.HashPartitioner;
import io.querymesh.source.QueryFileReader;
import io.querymesh.transpile.TranspileException;
import io.querymesh.transpile.TranspileRequest;
import io.querymesh.transpile.TranspileResult;
import io.querymesh.transpile.Transpiler;
import io.querymesh.transpile.TranspilerUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts every distinct query of one (file, shard) pair. Produces rows only; appending them is
 * the worker's job.
 */
public final class TaskExecutor {
    private static final Logger logger = LoggerFactory.getLogger(TaskExecutor.class);

    private final QueryFileReader reader;
    private final Transpiler transpiler;

    public TaskExecutor(QueryFileReader reader, Transpiler transpiler) {
        this.reader = reader;
        this.transpiler = transpiler;
    }

    public TaskExecutionResult execute(TaskDescriptor task) throws TaskExecutionException {
        String batchId = batchIdFor(task);
        Set<String> queries = collectShardQueries(task);

        List<ResultRow> rows = new ArrayList<>(queries.size());
        int succeeded = 0;
        for (String query : queries) {
            ResultRow row = convert(task, batchId, query);
            if (row.succeeded()) {
                succeeded++;
            }
            rows.add(row);
        }
        int failed = rows.size() - succeeded;
        logger.info("Task {} converted {} queries for batch {} ({} failed)", task.taskId(), rows.size(), batchId, failed);
        return new TaskExecutionResult(batchId, rows, rows.size(), succeeded, failed);
    }

    /**
     * {@code <session>_<file stem>_batch_<remainder>}.
     */
    public static String batchIdFor(TaskDescriptor task) {
        String fileName = Path.of(task.filePath()).getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return task.sessionId() + "_" + stem + "_batch_" + task.remainder();
    }

    private Set<String> collectShardQueries(TaskDescriptor task) throws TaskExecutionException {
        // Insertion order keeps row order stable across redeliveries.
        Set<String> queries = new LinkedHashSet<>();
        try {
            reader.read(Path.of(task.filePath()), task.queryColumn(), row -> {
                if (!row.hasQuery() || !row.matches(task.filters())) {
                    return;
                }
                String query = row.query().strip();
                if (HashPartitioner.belongsTo(query, task.remainder(), task.totalShards())) {
                    queries.add(query);
                }
            });
        } catch (IOException e) {
            throw new TaskExecutionException(task.taskId(), "Failed to read input file " + task.filePath() + ": " + e.getMessage(), e);
        }
        return queries;
    }

    private ResultRow convert(TaskDescriptor task, String batchId, String query) throws TaskExecutionException {
        long started = System.nanoTime();
        try {
            TranspileResult result = transpiler.transpile(
                    new TranspileRequest(query, task.fromDialect(), task.toDialect(), task.featureFlags())
            );
            long elapsedMs = elapsedMs(started);
            if (!result.executable()) {
                String error = result.unsupportedFunctions().isEmpty()
                        ? "query is not executable in " + task.toDialect()
                        : "unsupported functions: " + String.join(", ", result.unsupportedFunctions());
                return row(task, batchId, query, ResultRow.STATUS_FAILED, result, elapsedMs, error);
            }
            return row(task, batchId, query, ResultRow.STATUS_SUCCESS, result, elapsedMs, null);
        } catch (TranspilerUnavailableException e) {
            throw new TaskExecutionException(task.taskId(), "Transpiler unavailable: " + e.getMessage(), e);
        } catch (TranspileException | RuntimeException e) {
            return row(task, batchId, query, ResultRow.STATUS_FAILED, null, elapsedMs(started), describe(e));
        }
    }

    private static ResultRow row(
            TaskDescriptor task,
            String batchId,
            String query,
            String status,
            TranspileResult result,
            long elapsedMs,
            String error
    ) {
        return new ResultRow(
                HashPartitioner.queryIdOf(query),
                task.sessionId(),
                batchId,
                Instant.now().toString(),
                status,
                task.fromDialect(),
                task.toDialect(),
                query,
                result == null ? null : result.convertedQuery(),
                result == null ? List.of() : result.supportedFunctions(),
                result == null ? List.of() : result.unsupportedFunctions(),
                result == null ? List.of() : result.udfs(),
                result == null ? List.of() : result.tables(),
                elapsedMs,
                error
        );
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }
}
