package io.querymesh.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One transpiled query outcome, as stored in the shared result table. Immutable once appended.
 */
public record ResultRow(
        @JsonProperty("query_id") long queryId,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("status") String status,
        @JsonProperty("from_dialect") String fromDialect,
        @JsonProperty("to_dialect") String toDialect,
        @JsonProperty("original_query") String originalQuery,
        @JsonProperty("converted_query") String convertedQuery,
        @JsonProperty("supported_functions") List<String> supportedFunctions,
        @JsonProperty("unsupported_functions") List<String> unsupportedFunctions,
        @JsonProperty("udf_list") List<String> udfList,
        @JsonProperty("tables_list") List<String> tablesList,
        @JsonProperty("processing_time_ms") long processingTimeMs,
        @JsonProperty("error_message") String errorMessage
) {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED = "failed";

    public ResultRow {
        supportedFunctions = supportedFunctions == null ? List.of() : List.copyOf(supportedFunctions);
        unsupportedFunctions = unsupportedFunctions == null ? List.of() : List.copyOf(unsupportedFunctions);
        udfList = udfList == null ? List.of() : List.copyOf(udfList);
        tablesList = tablesList == null ? List.of() : List.copyOf(tablesList);
    }

    public boolean succeeded() {
        return STATUS_SUCCESS.equals(status);
    }
}
