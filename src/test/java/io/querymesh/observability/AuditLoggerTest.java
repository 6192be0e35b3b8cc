package io.querymesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.querymesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsAreChainedByHash() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, "tenant-a");
            audit.log(AuditLogger.AuditEvent.of("session.created", "dispatcher", "session/ses_1", "processing", Map.of("total_shards", 4)));
            audit.log(AuditLogger.AuditEvent.forTask("task.completed", "w1", "ses_1", "tsk_1", "completed", null));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());
            JsonNode first = Jsons.mapper().readTree(lines.get(0));
            JsonNode second = Jsons.mapper().readTree(lines.get(1));
            Assertions.assertEquals("", first.path("prev_hash").asText());
            Assertions.assertEquals(first.path("hash").asText(), second.path("prev_hash").asText());
            Assertions.assertEquals("tenant-a", second.path("namespace").asText());
            Assertions.assertEquals("task/tsk_1", second.path("resource").asText());
            Assertions.assertEquals("ses_1", second.path("session_id").asText());
            Assertions.assertEquals(4, first.path("details").path("total_shards").asInt());
            Assertions.assertEquals(second.path("hash").asText(), audit.currentHash());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reopenedLogContinuesTheChain() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-audit-reopen-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger before = new AuditLogger(file, null);
            before.log(AuditLogger.AuditEvent.of("queue.reclaim", "system", "queue/processing", "reclaimed", Map.of()));
            String lastHash = before.currentHash();

            AuditLogger after = new AuditLogger(file, null);
            Assertions.assertEquals(lastHash, after.currentHash());
            after.log(AuditLogger.AuditEvent.of("session.purge", "system", "sessions", "purged", Map.of()));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            JsonNode last = Jsons.mapper().readTree(lines.get(1));
            Assertions.assertEquals(lastHash, last.path("prev_hash").asText());
            Assertions.assertEquals("default", last.path("namespace").asText());
        } finally {
            deleteRecursively(root);
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
