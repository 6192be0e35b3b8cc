package io.querymesh.transpile;

/**
 * The engine could not be reached at all. Fails the whole task, which is then retried.
 */
public final class TranspilerUnavailableException extends RuntimeException {
    public TranspilerUnavailableException(String message) {
        super(message);
    }

    public TranspilerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
