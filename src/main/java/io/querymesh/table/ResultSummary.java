package io.querymesh.table;

import java.util.List;
import java.util.Map;

public record ResultSummary(
        String tableName,
        String sessionId,
        long totalRows,
        long distinctQueries,
        Map<String, Long> rowsByStatus,
        List<String> topUnsupportedFunctions,
        long averageProcessingTimeMs
) {
}
