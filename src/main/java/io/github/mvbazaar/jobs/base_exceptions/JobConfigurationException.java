package io.github.mvbazaar.jobs.base_exceptions;

/**
 * Raised when a job cannot be registered or the job setup is malformed.
 * The host process is expected to abort startup on this exception.
 */
public class JobConfigurationException extends Exception {
    public JobConfigurationException(String message) {
        super(message);
    }

    public JobConfigurationException(Throwable cause) {
        super(cause);
    }

    public JobConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobConfigurationException(Throwable cause, String message) {
        super(message, cause);
    }
}
