package io.querymesh.runtime;

import io.querymesh.model.ResultRow;
import io.querymesh.model.TaskDescriptor;
import io.querymesh.partition.HashPartitioner;
import io.querymesh.source.JsonLinesQueryFileReader;
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
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

final class TaskExecutorTest {

    @Test
    void unsupportedFunctionFailsOnlyThatRow() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-executor-foo-");
        try {
            Path file = root.resolve("queries.jsonl");
            Files.writeString(file, String.join("\n",
                    "{\"query\":\"SELECT 1\"}",
                    "{\"query\":\"SELECT FOO(x) FROM t\"}",
                    "{\"query\":\"  SELECT 1  \"}",
                    "",
                    "{\"query\":\"SELECT 2\"}"
            ), StandardCharsets.UTF_8);

            TaskExecutor executor = new TaskExecutor(new JsonLinesQueryFileReader(), new FooRejectingTranspiler());
            TaskExecutionResult result = executor.execute(task("ses_a", file, 0, 1, Map.of()));

            Assertions.assertEquals("ses_a_queries_batch_0", result.batchId());
            Assertions.assertEquals(3, result.attempted());
            Assertions.assertEquals(2, result.succeeded());
            Assertions.assertEquals(1, result.failed());

            ResultRow foo = result.rows().stream()
                    .filter(row -> row.originalQuery().contains("FOO"))
                    .findFirst()
                    .orElseThrow();
            Assertions.assertEquals(ResultRow.STATUS_FAILED, foo.status());
            Assertions.assertEquals(List.of("FOO"), foo.unsupportedFunctions());
            Assertions.assertEquals("unsupported functions: FOO", foo.errorMessage());
            Assertions.assertEquals(HashPartitioner.queryIdOf("SELECT FOO(x) FROM t"), foo.queryId());

            for (ResultRow row : result.rows()) {
                Assertions.assertEquals("ses_a", row.sessionId());
                Assertions.assertEquals(result.batchId(), row.batchId());
                Assertions.assertEquals("hive", row.fromDialect());
                Assertions.assertEquals("trino", row.toDialect());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void shardsPartitionTheDistinctQueriesOfAFile() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-executor-shards-");
        try {
            Path file = root.resolve("corpus.jsonl");
            StringBuilder content = new StringBuilder();
            for (int i = 0; i < 40; i++) {
                content.append("{\"query\":\"SELECT ").append(i % 25).append(" FROM t\"}\n");
            }
            Files.writeString(file, content.toString(), StandardCharsets.UTF_8);

            TaskExecutor executor = new TaskExecutor(new JsonLinesQueryFileReader(), new FooRejectingTranspiler());
            Set<String> seen = new HashSet<>();
            int total = 0;
            for (int remainder = 0; remainder < 3; remainder++) {
                TaskExecutionResult result = executor.execute(task("ses_b", file, remainder, 3, Map.of()));
                for (ResultRow row : result.rows()) {
                    Assertions.assertTrue(HashPartitioner.belongsTo(row.originalQuery(), remainder, 3));
                    seen.add(row.originalQuery());
                }
                total += result.attempted();
            }
            Assertions.assertEquals(25, total);
            Assertions.assertEquals(25, seen.size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void filtersAndQueryColumnSelectRows() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-executor-filters-");
        try {
            Path file = root.resolve("mixed.jsonl");
            Files.writeString(file, String.join("\n",
                    "{\"sql\":\"SELECT a FROM x\",\"engine\":\"hive\"}",
                    "{\"sql\":\"SELECT b FROM y\",\"engine\":\"spark\"}",
                    "{\"sql\":null,\"engine\":\"hive\"}",
                    "{\"engine\":\"hive\"}"
            ), StandardCharsets.UTF_8);

            TaskExecutor executor = new TaskExecutor(new JsonLinesQueryFileReader(), new FooRejectingTranspiler());
            TaskDescriptor task = new TaskDescriptor(
                    "tsk_f", "ses_c", file.toString(), 0, 1, "sql", "hive", "trino", 1,
                    Map.of(), Map.of("engine", "hive"), 0, Instant.now().toEpochMilli()
            );
            TaskExecutionResult result = executor.execute(task);

            Assertions.assertEquals(
                    List.of("SELECT a FROM x"),
                    result.rows().stream().map(ResultRow::originalQuery).collect(Collectors.toList())
            );
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void perQueryErrorsAreRecordedOnTheRow() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-executor-errors-");
        try {
            Path file = root.resolve("broken.jsonl");
            Files.writeString(file, "{\"query\":\"SELEC nonsense\"}\n{\"query\":\"SELECT crash\"}\n", StandardCharsets.UTF_8);

            Transpiler transpiler = new Transpiler() {
                @Override
                public String id() {
                    return "failing";
                }

                @Override
                public TranspileResult transpile(TranspileRequest request) throws TranspileException {
                    if (request.query().startsWith("SELEC ")) {
                        throw new TranspileException("parse error at 1:1");
                    }
                    throw new IllegalStateException();
                }
            };
            TaskExecutionResult result = new TaskExecutor(new JsonLinesQueryFileReader(), transpiler)
                    .execute(task("ses_d", file, 0, 1, Map.of()));

            Assertions.assertEquals(0, result.succeeded());
            Assertions.assertEquals(2, result.failed());
            Assertions.assertEquals("parse error at 1:1", result.rows().get(0).errorMessage());
            Assertions.assertEquals("IllegalStateException", result.rows().get(1).errorMessage());
            Assertions.assertNull(result.rows().get(0).convertedQuery());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreadableFileFailsTheWholeTask() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-executor-unreadable-");
        try {
            Path file = root.resolve("bad.jsonl");
            Files.writeString(file, "{\"query\":\"SELECT 1\"}\nnot json\n", StandardCharsets.UTF_8);
            TaskExecutor executor = new TaskExecutor(new JsonLinesQueryFileReader(), new FooRejectingTranspiler());

            TaskExecutionException malformed = Assertions.assertThrows(
                    TaskExecutionException.class,
                    () -> executor.execute(task("ses_e", file, 0, 1, Map.of()))
            );
            Assertions.assertEquals("tsk_ses_e_0", malformed.taskId());

            Assertions.assertThrows(
                    TaskExecutionException.class,
                    () -> executor.execute(task("ses_e", root.resolve("missing.jsonl"), 0, 1, Map.of()))
            );
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unavailableTranspilerFailsTheWholeTask() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-executor-unavailable-");
        try {
            Path file = root.resolve("queries.jsonl");
            Files.writeString(file, "{\"query\":\"SELECT 1\"}\n", StandardCharsets.UTF_8);
            Transpiler down = new Transpiler() {
                @Override
                public String id() {
                    return "down";
                }

                @Override
                public TranspileResult transpile(TranspileRequest request) {
                    throw new TranspilerUnavailableException("connection refused");
                }
            };

            TaskExecutionException error = Assertions.assertThrows(
                    TaskExecutionException.class,
                    () -> new TaskExecutor(new JsonLinesQueryFileReader(), down).execute(task("ses_f", file, 0, 1, Map.of()))
            );
            Assertions.assertTrue(error.getMessage().contains("connection refused"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static TaskDescriptor task(String sessionId, Path file, int remainder, int totalShards, Map<String, String> filters) {
        return new TaskDescriptor(
                "tsk_" + sessionId + "_" + remainder,
                sessionId,
                file.toString(),
                remainder,
                totalShards,
                "query",
                "hive",
                "trino",
                10,
                Map.of(),
                filters,
                0,
                Instant.now().toEpochMilli()
        );
    }

    static final class FooRejectingTranspiler implements Transpiler {
        @Override
        public String id() {
            return "foo-rejecting";
        }

        @Override
        public TranspileResult transpile(TranspileRequest request) {
            if (request.query().contains("FOO(")) {
                return new TranspileResult(null, List.of(), List.of("FOO"), List.of(), List.of("t"), false);
            }
            return TranspileResult.executable(request.query().toLowerCase(), List.of(), List.of());
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
