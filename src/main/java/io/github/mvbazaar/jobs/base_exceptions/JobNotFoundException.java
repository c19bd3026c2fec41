package io.github.mvbazaar.jobs.base_exceptions;

public class JobNotFoundException extends Exception {
    public JobNotFoundException(String message) {
        super(message);
    }

    public JobNotFoundException(Throwable cause) {
        super(cause);
    }

    public JobNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobNotFoundException(Throwable cause, String message) {
        super(message, cause);
    }
}
