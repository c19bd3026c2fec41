package io.github.mvbazaar.jobs.schedulers;

import java.time.Instant;

/**
 * Job event listener. Exceptions thrown by listeners are logged and otherwise ignored.
 */
public interface JobEventListener {
    default void onStart(String jobName, Instant startedAt) {
    }

    /**
     * Every finished execution, successful or not.
     */
    default void onComplete(String jobName, Instant startedAt, Instant finishedAt, JobResult result) {
    }

    /**
     * The handler threw; {@code result} is the failed result recorded for it.
     */
    default void onError(String jobName, Throwable error, JobResult result) {
    }

    /**
     * An execution attempt was dropped because the job was already running.
     */
    default void onRejected(String jobName) {
    }
}
