package io.querymesh.lock;

import io.querymesh.config.QueryMeshSettings;
import io.querymesh.observability.AuditLogger;
import io.querymesh.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Picks the lock backend once at startup.
 */
public final class DistributedLocks {
    private static final Logger logger = LoggerFactory.getLogger(DistributedLocks.class);

    private DistributedLocks() {
    }

    /**
     * Returns the shared lock when configured and reachable. Otherwise falls back to a
     * process-local lock and reports the degraded mode in both the log and the audit trail.
     */
    public static DistributedLock open(QueryMeshSettings settings, Database database, AuditLogger auditLogger) {
        long poll = settings.lockPollIntervalMs();
        String reason;
        if (QueryMeshSettings.LOCK_BACKEND_LOCAL.equals(settings.lockBackend())) {
            reason = "configured";
        } else if (database.ping()) {
            return new SqliteDistributedLock(database, poll);
        } else {
            reason = "shared_backend_unreachable";
        }
        logger.warn("Lock backend degraded to process-local mutex ({}); appends are only serialized within this process",
                reason);
        if (auditLogger != null) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "lock.backend.degraded",
                    "system",
                    "lock/backend",
                    "local",
                    Map.of("reason", reason)
            ));
        }
        return new LocalDistributedLock(poll);
    }
}
