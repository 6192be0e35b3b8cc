package io.querymesh.runtime;

import io.querymesh.bus.TaskQueue;
import io.querymesh.config.QueryMeshConfig;
import io.querymesh.config.QueryMeshSettings;
import io.querymesh.lock.DistributedLock;
import io.querymesh.lock.DistributedLocks;
import io.querymesh.model.SessionStatusView;
import io.querymesh.observability.AuditLogger;
import io.querymesh.source.JsonLinesQueryFileReader;
import io.querymesh.source.QueryFileReader;
import io.querymesh.storage.Database;
import io.querymesh.storage.SessionStore;
import io.querymesh.table.AppendPolicy;
import io.querymesh.table.ResultSummary;
import io.querymesh.table.SharedTableWriter;
import io.querymesh.table.SqliteResultTable;
import io.querymesh.transpile.PassthroughTranspiler;
import io.querymesh.transpile.ScriptTranspiler;
import io.querymesh.transpile.TranspilerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Wires the stores, the queue, the lock and the engine for one runtime root. Built explicitly by
 * the CLI or a test and passed around; nothing here is a process-wide singleton.
 */
public final class QueryMeshRuntime {
    private static final Logger logger = LoggerFactory.getLogger(QueryMeshRuntime.class);

    private final QueryMeshConfig config;
    private final QueryMeshSettings settingsOverride;
    private final Database database;
    private final SessionStore sessionStore;
    private final TaskQueue taskQueue;
    private final AuditLogger auditLogger;
    private final TranspilerRegistry transpilerRegistry;
    private final QueryFileReader reader;
    private volatile QueryMeshSettings settings;
    private volatile DistributedLock lock;

    public QueryMeshRuntime(QueryMeshConfig config) {
        this(config, null);
    }

    /**
     * @param settingsOverride used instead of the settings file when non-null
     */
    public QueryMeshRuntime(QueryMeshConfig config, QueryMeshSettings settingsOverride) {
        this.config = config;
        this.settingsOverride = settingsOverride;
        this.database = new Database(config);
        this.sessionStore = new SessionStore(database);
        this.taskQueue = new TaskQueue(config);
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace());
        this.transpilerRegistry = new TranspilerRegistry();
        this.reader = new JsonLinesQueryFileReader();
        this.settings = settingsOverride == null ? QueryMeshSettings.defaults() : settingsOverride;
        transpilerRegistry.register(new PassthroughTranspiler());
    }

    public void init() {
        database.init();
        settings = settingsOverride == null ? QueryMeshSettings.load(config.settingsFile()) : settingsOverride;
        registerConfiguredTranspiler();
        lock = DistributedLocks.open(settings, database, auditLogger);
    }

    private void registerConfiguredTranspiler() {
        if (settings.transpilerCommand().isEmpty()) {
            return;
        }
        transpilerRegistry.register(new ScriptTranspiler(
                settings.transpilerId(), settings.transpilerCommand(), settings.transpilerTimeoutMs()
        ));
        logger.info("Registered script transpiler {}", settings.transpilerId());
    }

    public Dispatcher dispatcher() {
        return new Dispatcher(sessionStore, taskQueue, reader, auditLogger, settings.targetShardSize());
    }

    public Dispatcher.DispatchOutcome dispatch(Dispatcher.DispatchRequest request) throws IOException {
        return dispatcher().dispatch(request);
    }

    /**
     * A worker with its own result-table handle; handles are not shared between threads.
     */
    public Worker newWorker(String workerId) {
        return new Worker(
                workerId,
                settings,
                sessionStore,
                taskQueue,
                new TaskExecutor(reader, transpilerRegistry.require(settings.transpilerId())),
                newWriter(),
                auditLogger
        );
    }

    public SharedTableWriter newWriter() {
        return new SharedTableWriter(requireLock(), newResultTable(), AppendPolicy.from(settings));
    }

    public SqliteResultTable newResultTable() {
        return new SqliteResultTable(database, settings.resultTableName(), settings.appendRequestTimeoutSeconds());
    }

    public Optional<SessionStatusView> sessionStatus(String sessionId) {
        return sessionStore.getSessionStatus(sessionId, Instant.now().toEpochMilli());
    }

    public ResultSummary results(String sessionId) {
        return newResultTable().summarize(sessionId);
    }

    public int reclaimStale(long olderThanMs) {
        int reclaimed = taskQueue.reclaimStale(olderThanMs);
        if (reclaimed > 0) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "queue.reclaim", "system", "queue/processing", "reclaimed",
                    Map.of("files", reclaimed, "older_than_ms", olderThanMs)
            ));
        }
        return reclaimed;
    }

    /**
     * Deletes finished sessions created more than {@code retention} ago.
     */
    public SessionStore.PurgeSummary purgeSessions(Duration retention) {
        long cutoff = Instant.now().minus(retention).toEpochMilli();
        SessionStore.PurgeSummary summary = sessionStore.purgeSessionsOlderThan(cutoff);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "session.purge", "system", "sessions", "purged",
                Map.of("sessions", summary.sessions(), "tasks", summary.tasks(), "cutoff_ms", cutoff)
        ));
        return summary;
    }

    private DistributedLock requireLock() {
        DistributedLock current = lock;
        if (current == null) {
            throw new IllegalStateException("Runtime not initialized: call init() first");
        }
        return current;
    }

    public QueryMeshConfig config() {
        return config;
    }

    public QueryMeshSettings settings() {
        return settings;
    }

    public SessionStore sessionStore() {
        return sessionStore;
    }

    public TaskQueue taskQueue() {
        return taskQueue;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public TranspilerRegistry transpilerRegistry() {
        return transpilerRegistry;
    }

    public DistributedLock lock() {
        return requireLock();
    }
}
