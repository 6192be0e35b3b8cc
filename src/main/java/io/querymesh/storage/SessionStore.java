package io.querymesh.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.querymesh.model.FileStats;
import io.querymesh.model.SessionStatus;
import io.querymesh.model.SessionStatusView;
import io.querymesh.model.SessionView;
import io.querymesh.model.TaskStatus;
import io.querymesh.model.TaskView;
import io.querymesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Session and task bookkeeping.
 *
 * <p>A task's status column is its membership set. The per-session counters live on the
 * session row and are only ever changed in the same transaction that changes a task's status,
 * so a reader never sees one without the other.
 */
public final class SessionStore {
    private static final TypeReference<List<FileStats>> FILE_STATS_LIST = new TypeReference<>() {
    };
    private static final String SESSION_COLUMNS = "session_id,source_path,from_dialect,to_dialect,query_column,total_files,"
            + "total_queries,unique_queries,total_shards,status,pending_count,processing_count,completed_count,failed_count,"
            + "file_stats,last_error,created_at_ms,updated_at_ms,finished_at_ms";
    private static final String TASK_COLUMNS = "task_id,session_id,file_path,remainder,total_shards,estimated_unique_count,"
            + "status,worker_id,retry_count,result_payload,last_error,created_at_ms,updated_at_ms,finished_at_ms";

    private final Database database;

    public SessionStore(Database database) {
        this.database = database;
    }

    public String createSession(SessionSpec spec) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                insertSession(c, spec);
                c.commit();
                return spec.sessionId();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to create session " + spec.sessionId(), e);
        }
    }

    /**
     * Adds one pending task to a processing session. The task's slot is counted as pending at once.
     */
    public String createTask(String sessionId, TaskSpec spec, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                insertTask(c, sessionId, spec, nowMs);
                c.commit();
                return spec.taskId();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to create task " + spec.taskId(), e);
        }
    }

    /**
     * Creates the session and all of its tasks in one transaction, so the counters sum to
     * {@code total_shards} from the first moment the session is visible.
     */
    public String createSessionWithTasks(SessionSpec spec, List<TaskSpec> tasks) {
        if (tasks.size() != spec.totalShards()) {
            throw new IllegalArgumentException(
                    "Task count " + tasks.size() + " does not match total_shards " + spec.totalShards()
            );
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                insertSession(c, spec);
                for (TaskSpec task : tasks) {
                    insertTask(c, spec.sessionId(), task, spec.nowMs());
                }
                c.commit();
                return spec.sessionId();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to create session " + spec.sessionId(), e);
        }
    }

    public TaskView transitionTask(String taskId, TaskStatus next, String workerId, long nowMs) {
        return transitionTask(taskId, next, workerId, null, null, nowMs);
    }

    /**
     * Moves a task to {@code next} and shifts the paired counters in one transaction.
     *
     * @throws TaskTransitionException if the move is not PENDING to PROCESSING or PROCESSING to a terminal status
     */
    public TaskView transitionTask(String taskId, TaskStatus next, String workerId, String resultPayload, String error, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                TaskView current = readTask(c, taskId)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
                TaskStatus from = current.taskStatus();
                if (!from.canTransitionTo(next)) {
                    throw new TaskTransitionException(taskId, from, next);
                }
                try (PreparedStatement up = c.prepareStatement(
                        "UPDATE session_tasks SET status=?,worker_id=COALESCE(?,worker_id),result_payload=COALESCE(?,result_payload),"
                                + "last_error=COALESCE(?,last_error),updated_at_ms=?,finished_at_ms=? WHERE task_id=? AND status=?")) {
                    up.setString(1, next.name());
                    up.setString(2, workerId);
                    up.setString(3, resultPayload);
                    up.setString(4, error);
                    up.setLong(5, nowMs);
                    if (next.isTerminal()) {
                        up.setLong(6, nowMs);
                    } else {
                        up.setNull(6, Types.INTEGER);
                    }
                    up.setString(7, taskId);
                    up.setString(8, from.name());
                    if (up.executeUpdate() == 0) {
                        throw new TaskTransitionException(taskId, from, next);
                    }
                }
                String fromColumn = counterColumn(from);
                String toColumn = counterColumn(next);
                try (PreparedStatement counters = c.prepareStatement(
                        "UPDATE sessions SET " + fromColumn + "=" + fromColumn + "-1," + toColumn + "=" + toColumn + "+1,"
                                + "updated_at_ms=? WHERE session_id=?")) {
                    counters.setLong(1, nowMs);
                    counters.setString(2, current.sessionId());
                    counters.executeUpdate();
                }
                TaskView updated = readTask(c, taskId).orElseThrow();
                c.commit();
                return updated;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to transition task " + taskId + " to " + next, e);
        }
    }

    /**
     * Re-stamps a task that is already PROCESSING when its descriptor is delivered again.
     * Counters are untouched because membership does not change.
     *
     * @return false when the task is not PROCESSING
     */
    public boolean recordRedelivery(String taskId, String workerId, int retryCount, long nowMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE session_tasks SET worker_id=?,retry_count=MAX(retry_count,?),updated_at_ms=? WHERE task_id=? AND status=?")) {
            ps.setString(1, workerId);
            ps.setInt(2, retryCount);
            ps.setLong(3, nowMs);
            ps.setString(4, taskId);
            ps.setString(5, TaskStatus.PROCESSING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to record redelivery of task " + taskId, e);
        }
    }

    public void recordTaskError(String taskId, String error, long nowMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE session_tasks SET last_error=?,updated_at_ms=? WHERE task_id=?")) {
            ps.setString(1, error);
            ps.setLong(2, nowMs);
            ps.setString(3, taskId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to record error for task " + taskId, e);
        }
    }

    /**
     * Marks the session COMPLETED when no task is pending or processing. Safe to race: exactly one
     * caller gets {@code true}; the rest see the session already completed.
     */
    public boolean tryCompleteSession(String sessionId, long nowMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE sessions SET status=?,finished_at_ms=?,updated_at_ms=? "
                             + "WHERE session_id=? AND status=? AND pending_count=0 AND processing_count=0 "
                             + "AND completed_count+failed_count=total_shards")) {
            ps.setString(1, SessionStatus.COMPLETED.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, sessionId);
            ps.setString(5, SessionStatus.PROCESSING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to complete session " + sessionId, e);
        }
    }

    /**
     * Marks a still-processing session FAILED. Used when dispatch aborts before all work is queued.
     */
    public boolean failSession(String sessionId, String error, long nowMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE sessions SET status=?,last_error=?,finished_at_ms=?,updated_at_ms=? WHERE session_id=? AND status=?")) {
            ps.setString(1, SessionStatus.FAILED.name());
            ps.setString(2, error);
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.setString(5, sessionId);
            ps.setString(6, SessionStatus.PROCESSING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to mark session failed " + sessionId, e);
        }
    }

    public Optional<SessionView> getSession(String sessionId) {
        try (Connection c = database.openConnection()) {
            return readSession(c, sessionId);
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to read session " + sessionId, e);
        }
    }

    public Optional<TaskView> getTask(String taskId) {
        try (Connection c = database.openConnection()) {
            return readTask(c, taskId);
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to read task " + taskId, e);
        }
    }

    /**
     * Tasks of a session ordered by remainder, then file. {@code status} may be null for all.
     */
    public List<TaskView> listSessionTasks(String sessionId, TaskStatus status) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM session_tasks WHERE session_id=?"
                + (status == null ? "" : " AND status=?")
                + " ORDER BY remainder ASC, file_path ASC";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            if (status != null) {
                ps.setString(2, status.name());
            }
            List<TaskView> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapTask(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to list tasks of session " + sessionId, e);
        }
    }

    public List<SessionView> listSessions(SessionStatus status, int limit) {
        String sql = "SELECT " + SESSION_COLUMNS + " FROM sessions"
                + (status == null ? "" : " WHERE status=?")
                + " ORDER BY created_at_ms DESC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, Math.max(1, limit));
            List<SessionView> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapSession(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to list sessions", e);
        }
    }

    public Optional<SessionStatusView> getSessionStatus(String sessionId, long nowMs) {
        return getSession(sessionId).map(s -> toStatusView(s, nowMs));
    }

    static SessionStatusView toStatusView(SessionView s, long nowMs) {
        int total = s.totalShards();
        int done = s.completedCount() + s.failedCount();
        double percentage = total <= 0 ? 0.0 : Math.round(done * 1000.0 / total) / 10.0;
        long endMs = s.finishedAtMs() == null ? nowMs : s.finishedAtMs();
        double elapsed = Math.max(0L, endMs - s.createdAtMs()) / 1000.0;
        double remaining = s.completedCount() > 0
                ? elapsed / s.completedCount() * s.pendingCount()
                : 0.0;
        double rate = elapsed > 0.0 ? s.completedCount() / elapsed : 0.0;
        return new SessionStatusView(
                s.sessionId(),
                s.status().toLowerCase(),
                new SessionStatusView.Progress(
                        total,
                        s.completedCount(),
                        s.failedCount(),
                        s.processingCount(),
                        s.pendingCount(),
                        percentage
                ),
                new SessionStatusView.Performance(round2(elapsed), round2(remaining), round2(rate))
        );
    }

    /**
     * Recomputes membership sizes from task rows and compares them with the stored counters.
     */
    public ProgressCheck verifyProgress(String sessionId) {
        try (Connection c = database.openConnection()) {
            // Both reads share one snapshot; a transition committed in between would look like drift.
            c.setAutoCommit(false);
            try {
                ProgressCheck check = readProgressCheck(c, sessionId);
                c.commit();
                return check;
            } catch (Exception e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to verify progress of session " + sessionId, e);
        }
    }

    private ProgressCheck readProgressCheck(Connection c, String sessionId) throws SQLException {
        SessionView session = readSession(c, sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
        Map<TaskStatus, Integer> membership = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            membership.put(status, 0);
        }
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT status, COUNT(*) AS n FROM session_tasks WHERE session_id=? GROUP BY status")) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    membership.put(TaskStatus.fromString(rs.getString("status")), rs.getInt("n"));
                }
            }
        }
        Map<TaskStatus, Integer> counters = new EnumMap<>(TaskStatus.class);
        counters.put(TaskStatus.PENDING, session.pendingCount());
        counters.put(TaskStatus.PROCESSING, session.processingCount());
        counters.put(TaskStatus.COMPLETED, session.completedCount());
        counters.put(TaskStatus.FAILED, session.failedCount());
        int sum = counters.values().stream().mapToInt(Integer::intValue).sum();
        return new ProgressCheck(sessionId, session.totalShards(), counters, membership,
                counters.equals(membership), sum == session.totalShards());
    }

    /**
     * Deletes terminal sessions created before {@code cutoffMs}, with their tasks. Result rows stay.
     */
    public PurgeSummary purgeSessionsOlderThan(long cutoffMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement tasks = c.prepareStatement(
                    "DELETE FROM session_tasks WHERE session_id IN "
                            + "(SELECT session_id FROM sessions WHERE status<>? AND created_at_ms<?)");
                 PreparedStatement sessions = c.prepareStatement(
                         "DELETE FROM sessions WHERE status<>? AND created_at_ms<?")) {
                tasks.setString(1, SessionStatus.PROCESSING.name());
                tasks.setLong(2, cutoffMs);
                int taskRows = tasks.executeUpdate();
                sessions.setString(1, SessionStatus.PROCESSING.name());
                sessions.setLong(2, cutoffMs);
                int sessionRows = sessions.executeUpdate();
                c.commit();
                return new PurgeSummary(sessionRows, taskRows);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to purge sessions", e);
        }
    }

    private void insertSession(Connection c, SessionSpec spec) throws SQLException {
        if (spec.totalShards() <= 0) {
            throw new IllegalArgumentException("total_shards must be > 0, got " + spec.totalShards());
        }
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO sessions(session_id,source_path,from_dialect,to_dialect,query_column,total_files,total_queries,"
                        + "unique_queries,total_shards,status,file_stats,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)")) {
            ps.setString(1, spec.sessionId());
            ps.setString(2, spec.sourcePath());
            ps.setString(3, spec.fromDialect());
            ps.setString(4, spec.toDialect());
            ps.setString(5, spec.queryColumn());
            ps.setInt(6, spec.totalFiles());
            ps.setLong(7, spec.totalQueries());
            ps.setLong(8, spec.uniqueQueries());
            ps.setInt(9, spec.totalShards());
            ps.setString(10, SessionStatus.PROCESSING.name());
            ps.setString(11, Jsons.toCompactJson(spec.fileStats()));
            ps.setLong(12, spec.nowMs());
            ps.setLong(13, spec.nowMs());
            ps.executeUpdate();
        }
    }

    private void insertTask(Connection c, String sessionId, TaskSpec spec, long nowMs) throws SQLException {
        if (spec.totalShards() <= 0 || spec.remainder() < 0 || spec.remainder() >= spec.totalShards()) {
            throw new IllegalArgumentException(
                    "remainder must be in [0, total_shards): remainder=" + spec.remainder() + ", total_shards=" + spec.totalShards()
            );
        }
        SessionView session = readSession(c, sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
        if (session.sessionStatus() != SessionStatus.PROCESSING) {
            throw new IllegalStateException("Session " + sessionId + " is " + session.status() + ", cannot add tasks");
        }
        int slots = session.pendingCount() + session.processingCount() + session.completedCount() + session.failedCount();
        if (slots >= session.totalShards()) {
            throw new IllegalStateException("Session " + sessionId + " already has " + slots + " of "
                    + session.totalShards() + " tasks");
        }
        try (PreparedStatement dup = c.prepareStatement(
                "SELECT task_id FROM session_tasks WHERE session_id=? AND file_path=? AND remainder=?")) {
            dup.setString(1, sessionId);
            dup.setString(2, spec.filePath());
            dup.setInt(3, spec.remainder());
            try (ResultSet rs = dup.executeQuery()) {
                if (rs.next()) {
                    throw new IllegalArgumentException("Task already exists for " + spec.filePath()
                            + " remainder " + spec.remainder() + ": " + rs.getString("task_id"));
                }
            }
        }
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO session_tasks(task_id,session_id,file_path,remainder,total_shards,estimated_unique_count,status,"
                        + "retry_count,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?,0,?,?)");
             PreparedStatement counters = c.prepareStatement(
                     "UPDATE sessions SET pending_count=pending_count+1,updated_at_ms=? WHERE session_id=?")) {
            ps.setString(1, spec.taskId());
            ps.setString(2, sessionId);
            ps.setString(3, spec.filePath());
            ps.setInt(4, spec.remainder());
            ps.setInt(5, spec.totalShards());
            ps.setLong(6, spec.estimatedUniqueCount());
            ps.setString(7, TaskStatus.PENDING.name());
            ps.setLong(8, nowMs);
            ps.setLong(9, nowMs);
            ps.executeUpdate();
            counters.setLong(1, nowMs);
            counters.setString(2, sessionId);
            counters.executeUpdate();
        }
    }

    private Optional<SessionView> readSession(Connection c, String sessionId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + SESSION_COLUMNS + " FROM sessions WHERE session_id=?")) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapSession(rs));
            }
        }
    }

    private Optional<TaskView> readTask(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + TASK_COLUMNS + " FROM session_tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapTask(rs));
            }
        }
    }

    private SessionView mapSession(ResultSet rs) throws SQLException {
        return new SessionView(
                rs.getString("session_id"),
                rs.getString("source_path"),
                rs.getString("from_dialect"),
                rs.getString("to_dialect"),
                rs.getString("query_column"),
                rs.getInt("total_files"),
                rs.getLong("total_queries"),
                rs.getLong("unique_queries"),
                rs.getInt("total_shards"),
                rs.getString("status"),
                rs.getInt("pending_count"),
                rs.getInt("processing_count"),
                rs.getInt("completed_count"),
                rs.getInt("failed_count"),
                parseFileStats(rs.getString("file_stats")),
                rs.getString("last_error"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                nullableLong(rs, "finished_at_ms")
        );
    }

    private TaskView mapTask(ResultSet rs) throws SQLException {
        return new TaskView(
                rs.getString("task_id"),
                rs.getString("session_id"),
                rs.getString("file_path"),
                rs.getInt("remainder"),
                rs.getInt("total_shards"),
                rs.getLong("estimated_unique_count"),
                rs.getString("status"),
                rs.getString("worker_id"),
                rs.getInt("retry_count"),
                rs.getString("result_payload"),
                rs.getString("last_error"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                nullableLong(rs, "finished_at_ms")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static List<FileStats> parseFileStats(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return Jsons.mapper().readValue(json, FILE_STATS_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt file_stats column", e);
        }
    }

    private static String counterColumn(TaskStatus status) {
        return switch (status) {
            case PENDING -> "pending_count";
            case PROCESSING -> "processing_count";
            case COMPLETED -> "completed_count";
            case FAILED -> "failed_count";
        };
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public record SessionSpec(
            String sessionId,
            String sourcePath,
            String fromDialect,
            String toDialect,
            String queryColumn,
            int totalFiles,
            long totalQueries,
            long uniqueQueries,
            int totalShards,
            List<FileStats> fileStats,
            long nowMs
    ) {
        public SessionSpec {
            fileStats = fileStats == null ? List.of() : List.copyOf(fileStats);
        }
    }

    public record TaskSpec(String taskId, String filePath, int remainder, int totalShards, long estimatedUniqueCount) {}

    public record ProgressCheck(
            String sessionId,
            int totalShards,
            Map<TaskStatus, Integer> counters,
            Map<TaskStatus, Integer> membership,
            boolean countersMatchMembership,
            boolean sumMatchesTotal
    ) {
        public boolean consistent() {
            return countersMatchMembership && sumMatchesTotal;
        }
    }

    public record PurgeSummary(int sessions, int tasks) {}
}
