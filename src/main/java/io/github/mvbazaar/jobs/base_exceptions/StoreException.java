package io.github.mvbazaar.jobs.base_exceptions;

/**
 * Failure reported by the storage collaborator.
 */
public class StoreException extends Exception {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(Throwable cause) {
        super(cause);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(Throwable cause, String message) {
        super(message, cause);
    }
}
