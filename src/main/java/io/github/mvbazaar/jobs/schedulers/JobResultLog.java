package io.github.mvbazaar.jobs.schedulers;

import com.google.common.annotations.Beta;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only, bounded history of finished executions per job.
 * Attach it with {@link JobScheduler#addListener(JobEventListener)}; it is independent of the status snapshot,
 * which only ever holds the latest result.
 */
@Beta
@ThreadSafe
public class JobResultLog implements JobEventListener {
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacityPerJob;

    @GuardedBy("this")
    private final Map<String, Deque<JobExecution>> history = new HashMap<>();

    public JobResultLog() {
        this(DEFAULT_CAPACITY);
    }

    public JobResultLog(int capacityPerJob) {
        if (capacityPerJob <= 0) {
            throw new IllegalArgumentException("capacityPerJob must be positive: " + capacityPerJob);
        }
        this.capacityPerJob = capacityPerJob;
    }

    @Override
    public void onComplete(String jobName, Instant startedAt, Instant finishedAt, JobResult result) {
        append(new JobExecution(jobName, startedAt, finishedAt, Duration.between(startedAt, finishedAt), result, null));
    }

    public synchronized void append(@NotNull JobExecution execution) {
        Deque<JobExecution> entries = history.computeIfAbsent(execution.getJobName(), k -> new ArrayDeque<>());
        entries.addLast(execution);
        while (entries.size() > capacityPerJob) {
            entries.removeFirst();
        }
    }

    /**
     * Oldest first.
     */
    public synchronized @NotNull List<JobExecution> history(@NotNull String jobName) {
        Deque<JobExecution> entries = history.get(jobName);
        return entries == null ? List.of() : ImmutableList.copyOf(entries);
    }

    public synchronized int size(@NotNull String jobName) {
        Deque<JobExecution> entries = history.get(jobName);
        return entries == null ? 0 : entries.size();
    }
}
