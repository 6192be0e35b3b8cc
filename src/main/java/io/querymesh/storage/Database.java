package io.querymesh.storage;

import io.querymesh.config.QueryMeshConfig;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Shared store for sessions, tasks, lock records and the result table. One SQLite file per
 * runtime root, opened per operation; write transactions begin IMMEDIATE so concurrent writers
 * queue on {@code busy_timeout} instead of failing on lock upgrade.
 */
public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "querymesh.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final QueryMeshConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(QueryMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MS);
        sqlite.enforceForeignKeys(true);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = sqlite.toProperties();
    }

    public String namespace() {
        return config.namespace();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    /**
     * Cheap round trip used to decide whether the shared lock backend is reachable.
     */
    public boolean ping() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM locks")) {
            return rs.next();
        } catch (SQLException e) {
            return false;
        }
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.inboxDir());
            Files.createDirectories(config.processingDir());
            Files.createDirectories(config.doneRoot());
            Files.createDirectories(config.deadRoot());
            Files.createDirectories(config.retryRoot());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS sessions (
                        session_id TEXT PRIMARY KEY,
                        source_path TEXT NOT NULL,
                        from_dialect TEXT NOT NULL,
                        to_dialect TEXT NOT NULL,
                        query_column TEXT NOT NULL,
                        total_files INTEGER NOT NULL,
                        total_queries INTEGER NOT NULL,
                        unique_queries INTEGER NOT NULL,
                        total_shards INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        pending_count INTEGER NOT NULL DEFAULT 0,
                        processing_count INTEGER NOT NULL DEFAULT 0,
                        completed_count INTEGER NOT NULL DEFAULT 0,
                        failed_count INTEGER NOT NULL DEFAULT 0,
                        file_stats TEXT NOT NULL DEFAULT '[]',
                        last_error TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        finished_at_ms INTEGER
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS session_tasks (
                        task_id TEXT PRIMARY KEY,
                        session_id TEXT NOT NULL,
                        file_path TEXT NOT NULL,
                        remainder INTEGER NOT NULL,
                        total_shards INTEGER NOT NULL,
                        estimated_unique_count INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        worker_id TEXT,
                        retry_count INTEGER NOT NULL DEFAULT 0,
                        result_payload TEXT,
                        last_error TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        finished_at_ms INTEGER,
                        UNIQUE(session_id, file_path, remainder),
                        FOREIGN KEY(session_id) REFERENCES sessions(session_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS locks (
                        lock_name TEXT PRIMARY KEY,
                        owner_token TEXT NOT NULL,
                        acquired_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS table_snapshots (
                        table_name TEXT PRIMARY KEY,
                        snapshot_id INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS result_rows (
                        row_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        table_name TEXT NOT NULL,
                        snapshot_id INTEGER NOT NULL,
                        query_id INTEGER NOT NULL,
                        session_id TEXT NOT NULL,
                        batch_id TEXT NOT NULL,
                        ts TEXT NOT NULL,
                        status TEXT NOT NULL,
                        from_dialect TEXT NOT NULL,
                        to_dialect TEXT NOT NULL,
                        original_query TEXT NOT NULL,
                        converted_query TEXT,
                        supported_functions TEXT NOT NULL,
                        unsupported_functions TEXT NOT NULL,
                        udf_list TEXT NOT NULL,
                        tables_list TEXT NOT NULL,
                        processing_time_ms INTEGER NOT NULL,
                        error_message TEXT
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_session_status ON session_tasks(session_id, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sessions_status_created ON sessions(status, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_locks_expires ON locks(expires_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261019_001_result_row_lookup",
                "Index result rows by table and session for summaries",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_result_rows_table_session ON result_rows(table_name, session_id)",
                        "CREATE INDEX IF NOT EXISTS idx_result_rows_batch ON result_rows(table_name, batch_id)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
            validatePragma(st, "busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
