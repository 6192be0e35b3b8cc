package io.querymesh.storage;

/**
 * The shared store could not be read or written. Callers must not treat the operation as applied.
 */
public final class SessionStoreException extends RuntimeException {
    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
