package io.querymesh.table;

import io.querymesh.model.ResultRow;
import io.querymesh.storage.Database;
import io.querymesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result table stored in the shared database with snapshot-versioned commits.
 *
 * <p>A commit bumps {@code table_snapshots.snapshot_id} from the handle's loaded value and inserts
 * the rows in the same transaction. If the bump matches no row, someone else committed first and
 * the append is rejected as a conflict. Every statement carries a query timeout so a stuck commit
 * cannot hold the append lock indefinitely.
 */
public final class SqliteResultTable implements ResultTable {
    private static final long NOT_LOADED = -1L;

    private final Database database;
    private final String tableName;
    private final int requestTimeoutSeconds;
    private volatile long loadedSnapshot = NOT_LOADED;

    public SqliteResultTable(Database database, String tableName, int requestTimeoutSeconds) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("table name cannot be empty");
        }
        this.database = database;
        this.tableName = tableName;
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    @Override
    public String name() {
        return tableName;
    }

    public long loadedSnapshot() {
        return loadedSnapshot;
    }

    @Override
    public void refresh() {
        try (Connection c = database.openConnection();
             PreparedStatement init = c.prepareStatement(
                     "INSERT OR IGNORE INTO table_snapshots(table_name,snapshot_id,updated_at_ms) VALUES(?,0,?)");
             PreparedStatement read = c.prepareStatement("SELECT snapshot_id FROM table_snapshots WHERE table_name=?")) {
            init.setQueryTimeout(requestTimeoutSeconds);
            init.setString(1, tableName);
            init.setLong(2, Instant.now().toEpochMilli());
            init.executeUpdate();
            read.setQueryTimeout(requestTimeoutSeconds);
            read.setString(1, tableName);
            try (ResultSet rs = read.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalStateException("Snapshot row missing for table " + tableName);
                }
                loadedSnapshot = rs.getLong("snapshot_id");
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to refresh result table " + tableName, e);
        }
    }

    @Override
    public int append(List<ResultRow> rows) throws TableConflictException {
        if (rows.isEmpty()) {
            return 0;
        }
        if (loadedSnapshot == NOT_LOADED) {
            refresh();
        }
        long base = loadedSnapshot;
        long next = base + 1L;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement bump = c.prepareStatement(
                    "UPDATE table_snapshots SET snapshot_id=?,updated_at_ms=? WHERE table_name=? AND snapshot_id=?");
                 PreparedStatement insert = c.prepareStatement(
                         "INSERT INTO result_rows(table_name,snapshot_id,query_id,session_id,batch_id,ts,status,from_dialect,"
                                 + "to_dialect,original_query,converted_query,supported_functions,unsupported_functions,udf_list,"
                                 + "tables_list,processing_time_ms,error_message) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)")) {
                bump.setQueryTimeout(requestTimeoutSeconds);
                bump.setLong(1, next);
                bump.setLong(2, Instant.now().toEpochMilli());
                bump.setString(3, tableName);
                bump.setLong(4, base);
                if (bump.executeUpdate() == 0) {
                    c.rollback();
                    throw new TableConflictException(tableName, base);
                }
                insert.setQueryTimeout(requestTimeoutSeconds);
                for (ResultRow row : rows) {
                    insert.setString(1, tableName);
                    insert.setLong(2, next);
                    insert.setLong(3, row.queryId());
                    insert.setString(4, row.sessionId());
                    insert.setString(5, row.batchId());
                    insert.setString(6, row.timestamp());
                    insert.setString(7, row.status());
                    insert.setString(8, row.fromDialect());
                    insert.setString(9, row.toDialect());
                    insert.setString(10, row.originalQuery());
                    insert.setString(11, row.convertedQuery());
                    insert.setString(12, Jsons.toCompactJson(row.supportedFunctions()));
                    insert.setString(13, Jsons.toCompactJson(row.unsupportedFunctions()));
                    insert.setString(14, Jsons.toCompactJson(row.udfList()));
                    insert.setString(15, Jsons.toCompactJson(row.tablesList()));
                    insert.setLong(16, row.processingTimeMs());
                    insert.setString(17, row.errorMessage());
                    insert.addBatch();
                }
                insert.executeBatch();
                c.commit();
                loadedSnapshot = next;
                return rows.size();
            } catch (TableConflictException e) {
                throw e;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append " + rows.size() + " rows to " + tableName, e);
        }
    }

    @Override
    public long countRows(String sessionId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT COUNT(*) FROM result_rows WHERE table_name=? AND session_id=?")) {
            ps.setString(1, tableName);
            ps.setString(2, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count rows of session " + sessionId, e);
        }
    }

    /**
     * Reads rows of one batch in commit order. Downstream readers use this; the writer never does.
     */
    public List<ResultRow> readBatch(String batchId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT * FROM result_rows WHERE table_name=? AND batch_id=? ORDER BY row_id ASC")) {
            ps.setString(1, tableName);
            ps.setString(2, batchId);
            List<ResultRow> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ResultRow(
                            rs.getLong("query_id"),
                            rs.getString("session_id"),
                            rs.getString("batch_id"),
                            rs.getString("ts"),
                            rs.getString("status"),
                            rs.getString("from_dialect"),
                            rs.getString("to_dialect"),
                            rs.getString("original_query"),
                            rs.getString("converted_query"),
                            Jsons.toStringList(rs.getString("supported_functions")),
                            Jsons.toStringList(rs.getString("unsupported_functions")),
                            Jsons.toStringList(rs.getString("udf_list")),
                            Jsons.toStringList(rs.getString("tables_list")),
                            rs.getLong("processing_time_ms"),
                            rs.getString("error_message")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read batch " + batchId, e);
        }
    }

    @Override
    public ResultSummary summarize(String sessionId) {
        try (Connection c = database.openConnection()) {
            long total = 0L;
            long distinct = 0L;
            long avgMs = 0L;
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT COUNT(*) AS n, COUNT(DISTINCT query_id) AS d, COALESCE(AVG(processing_time_ms),0) AS avg_ms "
                            + "FROM result_rows WHERE table_name=? AND session_id=?")) {
                ps.setString(1, tableName);
                ps.setString(2, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        total = rs.getLong("n");
                        distinct = rs.getLong("d");
                        avgMs = Math.round(rs.getDouble("avg_ms"));
                    }
                }
            }
            Map<String, Long> byStatus = new LinkedHashMap<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT status, COUNT(*) AS n FROM result_rows WHERE table_name=? AND session_id=? GROUP BY status ORDER BY status")) {
                ps.setString(1, tableName);
                ps.setString(2, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        byStatus.put(rs.getString("status"), rs.getLong("n"));
                    }
                }
            }
            List<String> topUnsupported = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT j.value AS fn, COUNT(*) AS n FROM result_rows r, json_each(r.unsupported_functions) j "
                            + "WHERE r.table_name=? AND r.session_id=? GROUP BY j.value ORDER BY n DESC, fn ASC LIMIT 10")) {
                ps.setString(1, tableName);
                ps.setString(2, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        topUnsupported.add(rs.getString("fn"));
                    }
                }
            }
            return new ResultSummary(tableName, sessionId, total, distinct, byStatus, topUnsupported, avgMs);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to summarize session " + sessionId, e);
        }
    }
}
