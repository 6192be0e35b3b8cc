package io.querymesh.lock;

import io.querymesh.storage.Database;
import io.querymesh.storage.SessionStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Lock records in the shared {@code locks} table. Acquisition clears an expired record for the
 * name and inserts the new token with {@code INSERT OR IGNORE} in one transaction, which is the
 * set-if-absent step.
 */
public final class SqliteDistributedLock implements DistributedLock {
    private final Database database;
    private final long pollIntervalMs;

    public SqliteDistributedLock(Database database, long pollIntervalMs) {
        this.database = database;
        this.pollIntervalMs = Math.max(1L, pollIntervalMs);
    }

    @Override
    public LockGuard acquire(String name, Duration timeout) throws LockTimeoutException {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("lock name cannot be empty");
        }
        long timeoutMs = Math.max(1L, timeout.toMillis());
        long deadline = Instant.now().toEpochMilli() + timeoutMs;
        String token = "lock_" + UUID.randomUUID();
        while (true) {
            long now = Instant.now().toEpochMilli();
            if (tryInsert(name, token, now, now + timeoutMs)) {
                return new LockGuard(name, token, now, now + timeoutMs);
            }
            long remaining = deadline - Instant.now().toEpochMilli();
            if (remaining <= 0L) {
                throw new LockTimeoutException(name, timeout);
            }
            try {
                Thread.sleep(Math.min(pollIntervalMs, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for lock " + name, e);
            }
        }
    }

    @Override
    public boolean release(LockGuard guard) {
        if (guard == null) {
            return false;
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM locks WHERE lock_name=? AND owner_token=?")) {
            ps.setString(1, guard.name());
            ps.setString(2, guard.ownerToken());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to release lock " + guard.name(), e);
        }
    }

    @Override
    public boolean shared() {
        return true;
    }

    private boolean tryInsert(String name, String token, long nowMs, long expiresAtMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement expire = c.prepareStatement(
                    "DELETE FROM locks WHERE lock_name=? AND expires_at_ms<=?");
                 PreparedStatement insert = c.prepareStatement(
                         "INSERT OR IGNORE INTO locks(lock_name,owner_token,acquired_at_ms,expires_at_ms) VALUES(?,?,?,?)")) {
                expire.setString(1, name);
                expire.setLong(2, nowMs);
                expire.executeUpdate();
                insert.setString(1, name);
                insert.setString(2, token);
                insert.setLong(3, nowMs);
                insert.setLong(4, expiresAtMs);
                boolean acquired = insert.executeUpdate() == 1;
                c.commit();
                return acquired;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to acquire lock " + name, e);
        }
    }
}
