package io.querymesh.table;

import io.querymesh.model.ResultRow;

import java.util.List;

/**
 * Handle on the shared append-only result table. A handle remembers the snapshot it last loaded;
 * an append commits only on top of that snapshot.
 */
public interface ResultTable {
    String name();

    /**
     * Reloads the handle to the latest committed snapshot.
     */
    void refresh();

    /**
     * Appends all rows as one commit.
     *
     * @return number of rows written
     * @throws TableConflictException if another writer committed after this handle's snapshot
     */
    int append(List<ResultRow> rows) throws TableConflictException;

    long countRows(String sessionId);

    ResultSummary summarize(String sessionId);
}
