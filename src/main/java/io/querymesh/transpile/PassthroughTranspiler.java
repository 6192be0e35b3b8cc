package io.querymesh.transpile;

import java.util.List;

/**
 * Returns the query unchanged. Used for smoke runs and when source and target dialect match.
 */
public final class PassthroughTranspiler implements Transpiler {
    public static final String ID = "passthrough";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public TranspileResult transpile(TranspileRequest request) throws TranspileException {
        if (request.query() == null || request.query().isBlank()) {
            throw new TranspileException("empty query");
        }
        return TranspileResult.executable(request.query().strip(), List.of(), List.of());
    }
}
