package io.querymesh.transpile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record TranspileRequest(
        @JsonProperty("query") String query,
        @JsonProperty("from_dialect") String fromDialect,
        @JsonProperty("to_dialect") String toDialect,
        @JsonProperty("feature_flags") Map<String, Object> featureFlags
) {
    public TranspileRequest {
        featureFlags = featureFlags == null ? Map.of() : featureFlags;
    }
}
