package io.querymesh.table;

/**
 * Another writer committed after the snapshot this handle was built on. Retry after a refresh.
 */
public final class TableConflictException extends Exception {
    private final long expectedSnapshot;

    public TableConflictException(String tableName, long expectedSnapshot) {
        super("Concurrent commit on table " + tableName + ": snapshot " + expectedSnapshot + " is no longer current");
        this.expectedSnapshot = expectedSnapshot;
    }

    public long expectedSnapshot() {
        return expectedSnapshot;
    }
}
