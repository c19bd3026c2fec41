package io.github.mvbazaar.jobs.base_exceptions;

/**
 * A deletion request is already pending for the user.
 */
public class DeletionConflictException extends DeletionStateException {
    public DeletionConflictException(String message) {
        super(message);
    }

    public DeletionConflictException(Throwable cause) {
        super(cause);
    }

    public DeletionConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    public DeletionConflictException(Throwable cause, String message) {
        super(message, cause);
    }
}
