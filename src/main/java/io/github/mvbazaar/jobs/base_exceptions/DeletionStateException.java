package io.github.mvbazaar.jobs.base_exceptions;

/**
 * Illegal transition of an account deletion request.
 */
public class DeletionStateException extends Exception {
    public DeletionStateException(String message) {
        super(message);
    }

    public DeletionStateException(Throwable cause) {
        super(cause);
    }

    public DeletionStateException(String message, Throwable cause) {
        super(message, cause);
    }

    public DeletionStateException(Throwable cause, String message) {
        super(message, cause);
    }
}
