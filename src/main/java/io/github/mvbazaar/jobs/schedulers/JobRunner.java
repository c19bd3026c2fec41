package io.github.mvbazaar.jobs.schedulers;

import com.google.common.base.Stopwatch;
import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Runs a single handler invocation and contains every failure it raises.
 * Never throws to the caller: a handler that throws, or returns nothing, yields a failed {@link JobResult}.
 */
@ThreadSafe
public class JobRunner {
    private final static Logger logger = LoggerFactory.getLogger(JobRunner.class);

    private final Clock clock;

    public JobRunner() {
        this(Clock.systemUTC());
    }

    public JobRunner(@NotNull Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public @NotNull JobExecution run(@NotNull JobDefinition job) {
        Instant startedAt = clock.instant();
        Stopwatch stopwatch = Stopwatch.createStarted();
        JobResult result;
        Throwable error = null;
        try {
            result = job.getHandler().execute();
            if (result == null) {
                error = new IllegalStateException("Handler of job '" + job.getName() + "' returned no result");
                result = JobResult.fromError(error);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            error = ie;
            result = JobResult.fromError(ie);
        } catch (Throwable t) {
            error = t;
            result = JobResult.fromError(t);
        }
        stopwatch.stop();

        JobExecution execution = new JobExecution(job.getName(), startedAt, clock.instant(), stopwatch.elapsed(), result, error);
        if (error != null) {
            logger.error("Job failed: {} after {} ms", job.getName(), execution.getDuration().toMillis(), error);
        }
        return execution;
    }
}
