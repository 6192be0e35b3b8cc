package io.querymesh.transpile;

/**
 * The SQL dialect conversion engine, seen as a synchronous, stateless function.
 */
public interface Transpiler {
    String id();

    /**
     * @throws TranspileException if this query cannot be parsed or converted
     * @throws TranspilerUnavailableException if the engine itself cannot be reached
     */
    TranspileResult transpile(TranspileRequest request) throws TranspileException;
}
