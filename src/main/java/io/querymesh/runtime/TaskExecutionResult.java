package io.querymesh.runtime;

import io.querymesh.model.ResultRow;

import java.util.List;

public record TaskExecutionResult(String batchId, List<ResultRow> rows, int attempted, int succeeded, int failed) {
    public TaskExecutionResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
