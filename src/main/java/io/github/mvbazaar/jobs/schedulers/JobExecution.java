package io.github.mvbazaar.jobs.schedulers;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One finished execution of a job: when it ran and what it produced.
 */
public final class JobExecution {
    private final String jobName;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Duration duration;
    private final JobResult result;
    private final Throwable error;

    JobExecution(String jobName, Instant startedAt, Instant finishedAt, Duration duration, JobResult result, @Nullable Throwable error) {
        this.jobName = Objects.requireNonNull(jobName);
        this.startedAt = Objects.requireNonNull(startedAt);
        this.finishedAt = Objects.requireNonNull(finishedAt);
        this.duration = Objects.requireNonNull(duration);
        this.result = Objects.requireNonNull(result);
        this.error = error;
    }

    public @NotNull String getJobName() {
        return jobName;
    }

    public @NotNull Instant getStartedAt() {
        return startedAt;
    }

    public @NotNull Instant getFinishedAt() {
        return finishedAt;
    }

    public @NotNull Duration getDuration() {
        return duration;
    }

    public @NotNull JobResult getResult() {
        return result;
    }

    /**
     * The throwable raised by the handler, if it threw.
     */
    public @Nullable Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return "JobExecution{jobName='" + jobName + "', startedAt=" + startedAt + ", duration=" + duration.toMillis() + "ms, result=" + result + '}';
    }
}
