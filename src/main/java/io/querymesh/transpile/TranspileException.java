package io.querymesh.transpile;

/**
 * One query could not be parsed or converted. Recorded on that query's result row only.
 */
public final class TranspileException extends Exception {
    public TranspileException(String message) {
        super(message);
    }

    public TranspileException(String message, Throwable cause) {
        super(message, cause);
    }
}
