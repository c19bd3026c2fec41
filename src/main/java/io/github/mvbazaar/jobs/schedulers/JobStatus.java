package io.github.mvbazaar.jobs.schedulers;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only snapshot of a registered job.
 */
public final class JobStatus {
    public final String name;
    public final String description;
    public final String schedule;
    public final boolean enabled;
    public final boolean isRunning;
    @Nullable
    public final Instant lastRun;
    @Nullable
    public final Instant nextRun;
    @Nullable
    public final Duration lastDuration;
    @Nullable
    public final JobResult lastResult;

    JobStatus(String name, String description, String schedule, boolean enabled, boolean isRunning,
              @Nullable Instant lastRun, @Nullable Instant nextRun, @Nullable Duration lastDuration, @Nullable JobResult lastResult) {
        this.name = name;
        this.description = description;
        this.schedule = schedule;
        this.enabled = enabled;
        this.isRunning = isRunning;
        this.lastRun = lastRun;
        this.nextRun = nextRun;
        this.lastDuration = lastDuration;
        this.lastResult = lastResult;
    }

    @Override
    public String toString() {
        return "JobStatus{name=" + name + ", schedule='" + schedule + "', enabled=" + enabled + ", isRunning=" + isRunning +
                ", lastRun=" + lastRun + ", nextRun=" + nextRun +
                (lastResult != null ? ", lastResult=" + lastResult : "") + '}';
    }
}
