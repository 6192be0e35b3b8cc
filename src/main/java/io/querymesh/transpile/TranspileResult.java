package io.querymesh.transpile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TranspileResult(
        @JsonProperty("converted_query") String convertedQuery,
        @JsonProperty("supported_functions") List<String> supportedFunctions,
        @JsonProperty("unsupported_functions") List<String> unsupportedFunctions,
        @JsonProperty("udfs") List<String> udfs,
        @JsonProperty("tables") List<String> tables,
        @JsonProperty("executable") boolean executable
) {
    public TranspileResult {
        supportedFunctions = supportedFunctions == null ? List.of() : List.copyOf(supportedFunctions);
        unsupportedFunctions = unsupportedFunctions == null ? List.of() : List.copyOf(unsupportedFunctions);
        udfs = udfs == null ? List.of() : List.copyOf(udfs);
        tables = tables == null ? List.of() : List.copyOf(tables);
    }

    public static TranspileResult executable(String convertedQuery, List<String> supportedFunctions, List<String> tables) {
        return new TranspileResult(convertedQuery, supportedFunctions, List.of(), List.of(), tables, true);
    }
}
