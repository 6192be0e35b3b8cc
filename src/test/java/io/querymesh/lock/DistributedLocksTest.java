package io.querymesh.lock;

import io.querymesh.config.QueryMeshConfig;
import io.querymesh.config.QueryMeshSettings;
import io.querymesh.observability.AuditLogger;
import io.querymesh.storage.Database;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;

final class DistributedLocksTest {

    @Test
    void opensSharedLockWhenDatabaseIsReachable() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-locks-shared-");
        try {
            QueryMeshConfig config = QueryMeshConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            AuditLogger audit = new AuditLogger(config.auditFile(), config.namespace());

            DistributedLock lock = DistributedLocks.open(QueryMeshSettings.defaults(), db, audit);

            Assertions.assertTrue(lock.shared());
            Assertions.assertInstanceOf(SqliteDistributedLock.class, lock);
            Assertions.assertFalse(Files.readString(config.auditFile(), StandardCharsets.UTF_8).contains("lock.backend.degraded"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fallsBackToLocalLockWhenSharedBackendIsUnreachable() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-locks-degraded-");
        try {
            QueryMeshConfig config = QueryMeshConfig.fromRoot(root.toString());
            AuditLogger audit = new AuditLogger(config.auditFile(), config.namespace());
            // Never initialized: the locks table does not exist, so the probe fails.
            Database db = new Database(config);

            DistributedLock lock = DistributedLocks.open(QueryMeshSettings.defaults(), db, audit);

            Assertions.assertFalse(lock.shared());
            String trail = Files.readString(config.auditFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(trail.contains("lock.backend.degraded"));
            Assertions.assertTrue(trail.contains("shared_backend_unreachable"));

            LockGuard guard = lock.acquire("append:b", Duration.ofSeconds(5));
            Assertions.assertThrows(LockTimeoutException.class, () -> lock.acquire("append:b", Duration.ofMillis(50)));
            Assertions.assertTrue(lock.release(guard));
            Assertions.assertFalse(lock.release(guard));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void honoursConfiguredLocalBackend() throws Exception {
        Path root = Files.createTempDirectory("querymesh-test-locks-local-");
        try {
            QueryMeshConfig config = QueryMeshConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            AuditLogger audit = new AuditLogger(config.auditFile(), config.namespace());
            Path settingsFile = config.settingsFile();
            Files.writeString(settingsFile, "{\"lockBackend\":\"local\"}", StandardCharsets.UTF_8);

            DistributedLock lock = DistributedLocks.open(QueryMeshSettings.load(settingsFile), db, audit);

            Assertions.assertInstanceOf(LocalDistributedLock.class, lock);
            Assertions.assertTrue(Files.readString(config.auditFile(), StandardCharsets.UTF_8).contains("\"configured\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void localLockExpiryAllowsTakeover() throws Exception {
        LocalDistributedLock lock = new LocalDistributedLock(5L);
        LockGuard stale = lock.acquire("append:x", Duration.ofMillis(30));
        Thread.sleep(80L);
        LockGuard fresh = lock.acquire("append:x", Duration.ofSeconds(1));
        Assertions.assertFalse(lock.release(stale));
        Assertions.assertTrue(lock.release(fresh));
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
