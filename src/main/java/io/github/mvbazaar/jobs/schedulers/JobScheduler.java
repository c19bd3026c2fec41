package io.github.mvbazaar.jobs.schedulers;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.mvbazaar.jobs.base_exceptions.JobConfigurationException;
import io.github.mvbazaar.jobs.base_exceptions.JobNotFoundException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * JobScheduler
 * - Registry of named jobs, each with a five-field cron schedule evaluated in UTC
 * - One recurring trigger per enabled job once {@link #start()} is called
 * - At most one execution per job name at any time; overlapping attempts are rejected, not queued
 * - Manual execution by name, bypassing the schedule and the enabled flag
 * - Status snapshots that never wait for a running job
 * <p>
 * {@link #stop()} only cancels the triggers. A handler already running is not interrupted and keeps
 * its name in the running set until it returns.
 */
@ThreadSafe
public final class JobScheduler implements JobSchedulerInterface {
    private final static Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    private final ThreadPoolExecutor executor;
    private final JobRunner runner;
    private final Clock clock;
    private final long shutdownGraceMillis;
    private final List<JobEventListener> listeners;

    @GuardedBy("this")
    private final Map<String, JobRecord> jobs = new LinkedHashMap<>();
    private final Set<String> runningJobs = ConcurrentHashMap.newKeySet();

    private final DelayQueue<ScheduledEntry> queue = new DelayQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();
    @GuardedBy("this")
    private Thread dispatcher;

    private JobScheduler(ThreadPoolExecutor executor, JobRunner runner, Clock clock, long shutdownGraceMillis,
                         List<JobEventListener> listeners) {
        this.executor = executor;
        this.clock = clock;
        this.runner = runner;
        this.shutdownGraceMillis = shutdownGraceMillis;
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    public static final class Builder {
        private ThreadPoolExecutor executor;
        private JobRunner runner;
        private Clock clock = Clock.systemUTC();
        private long shutdownGraceMillis = 30_000; // 30s
        private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

        /**
         * Provide your own custom thread pool for triggered and asynchronous runs.
         */
        public Builder executor(ThreadPoolExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder runner(JobRunner runner) {
            this.runner = Objects.requireNonNull(runner);
            return this;
        }

        /**
         * Time source for trigger computation and dispatch.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        /**
         * How long {@link #close()} waits for running jobs before interrupting them.
         */
        public Builder shutdownGrace(Duration grace) {
            this.shutdownGraceMillis = Objects.requireNonNull(grace).toMillis();
            return this;
        }

        public Builder addListener(JobEventListener l) {
            listeners.add(Objects.requireNonNull(l));
            return this;
        }

        public JobScheduler build() {
            if (executor == null) {
                executor = new ThreadPoolExecutor(
                        Math.max(2, Runtime.getRuntime().availableProcessors()),
                        Math.max(4, Runtime.getRuntime().availableProcessors() * 2),
                        60, TimeUnit.SECONDS,
                        new LinkedBlockingQueue<>(),
                        r -> {
                            Thread t = new Thread(r, "job-exec-" + UUID.randomUUID());
                            t.setDaemon(false);
                            t.setUncaughtExceptionHandler((th, ex) ->
                                    logger.error("Uncaught exception in {}", th.getName(), ex));
                            return t;
                        },
                        new ThreadPoolExecutor.CallerRunsPolicy()
                );
                executor.allowCoreThreadTimeOut(true);
            }
            if (runner == null) {
                runner = new JobRunner();
            }
            return new JobScheduler(executor, runner, clock, shutdownGraceMillis, listeners);
        }
    }

    // ======== Public API ========

    @Override
    public void addListener(JobEventListener l) {
        listeners.add(Objects.requireNonNull(l));
    }

    @Override
    public void removeListener(JobEventListener l) {
        listeners.remove(l);
    }

    /**
     * Adds a job to the registry.
     *
     * @throws JobConfigurationException if the name is taken or the schedule is not a valid five-field cron expression;
     *                                   the job is not registered in that case
     */
    @Override
    public synchronized void register(@NotNull JobDefinition job) throws JobConfigurationException {
        Objects.requireNonNull(job, "job");
        if (jobs.containsKey(job.getName())) {
            throw new JobConfigurationException("Job with name \"" + job.getName() + "\" is already registered");
        }
        CronExpression cron;
        try {
            cron = CronExpression.parse(job.getSchedule());
        } catch (IllegalArgumentException e) {
            throw new JobConfigurationException("Invalid cron expression for job \"" + job.getName() + "\": " + job.getSchedule(), e);
        }
        if (cron.next(clock.instant()).isEmpty()) {
            throw new JobConfigurationException("Cron of job \"" + job.getName() + "\" has no future fire time: " + job.getSchedule());
        }

        JobRecord rec = new JobRecord(job, cron);
        jobs.put(job.getName(), rec);
        logger.info("Registered job: {} ({}), enabled={}", job.getName(), job.getSchedule(), job.isEnabled());

        if (running.get() && job.isEnabled()) {
            schedule(rec, generation.get());
        }
    }

    /**
     * Establishes one UTC trigger per enabled job and starts dispatching.
     */
    @Override
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warn("Job scheduler already started");
            return;
        }
        logger.info("Starting job scheduler");

        long gen = generation.incrementAndGet();
        int active = 0;
        for (JobRecord rec : jobs.values()) {
            if (!rec.job.isEnabled()) {
                logger.debug("Skipping disabled job: {}", rec.job.getName());
                continue;
            }
            schedule(rec, gen);
            active++;
        }

        dispatcher = new Thread(() -> dispatchLoop(gen), "job-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();

        logger.info("Job scheduler started with {} active jobs", active);
    }

    /**
     * Cancels all triggers. Running executions are left to finish.
     */
    @Override
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Stopping job scheduler");
        generation.incrementAndGet();
        queue.clear();
        if (dispatcher != null) {
            dispatcher.interrupt();
            dispatcher = null;
        }
        for (JobRecord rec : jobs.values()) {
            rec.nextRun = null;
        }
        logger.info("Job scheduler stopped");
    }

    /**
     * Runs the job on the calling thread, ignoring its schedule and enabled flag.
     * Subject to the same single-flight rule as triggered runs.
     */
    @Override
    public @NotNull JobResult runNow(@NotNull String jobName) throws JobNotFoundException {
        requireRegistered(jobName);
        logger.info("Manually triggering job: {}", jobName);
        return execute(jobName);
    }

    /**
     * Same as {@link #runNow(String)} but executed on the scheduler's worker pool.
     */
    @Override
    public @NotNull CompletableFuture<JobResult> runNowAsync(@NotNull String jobName) throws JobNotFoundException {
        requireRegistered(jobName);
        logger.info("Manually triggering job asynchronously: {}", jobName);
        return CompletableFuture.supplyAsync(() -> execute(jobName), executor);
    }

    @Override
    public synchronized @NotNull JobStatistics getStatus() {
        List<JobStatus> statuses = new ArrayList<>(jobs.size());
        int enabled = 0;
        for (JobRecord rec : jobs.values()) {
            statuses.add(snapshot(rec));
            if (rec.job.isEnabled()) enabled++;
        }
        return new JobStatistics(jobs.size(), enabled, runningJobs.size(), statuses);
    }

    @Override
    public synchronized @NotNull Optional<JobStatus> getJobStatus(@NotNull String jobName) {
        JobRecord rec = jobs.get(jobName);
        if (rec == null) return Optional.empty();
        return Optional.of(snapshot(rec));
    }

    public synchronized @NotNull List<String> getJobNames() {
        return List.copyOf(jobs.keySet());
    }

    /**
     * Stops the triggers and shuts the worker pool down, waiting for running jobs up to the shutdown grace.
     */
    @Override
    public void close() {
        stop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownGraceMillis, TimeUnit.MILLISECONDS)) {
                logger.warn("Jobs still running after {} ms, interrupting: {}", shutdownGraceMillis, runningJobs);
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    // ======== Internal ========

    private synchronized void requireRegistered(String jobName) throws JobNotFoundException {
        if (!jobs.containsKey(jobName)) {
            throw new JobNotFoundException("Job \"" + jobName + "\" not found");
        }
    }

    private synchronized JobRecord lookup(String jobName) {
        return jobs.get(jobName);
    }

    private void schedule(JobRecord rec, long gen) {
        Instant next = rec.cron.next(clock.instant()).orElse(null);
        rec.nextRun = next;
        if (next == null) {
            logger.warn("Job {} has no future fire time, not scheduling", rec.job.getName());
            return;
        }
        queue.offer(new ScheduledEntry(rec.job.getName(), next.toEpochMilli(), gen, clock));
        logger.info("Scheduled job: {} next run at {}", rec.job.getName(), next);
    }

    private void dispatchLoop(long gen) {
        while (running.get() && generation.get() == gen) {
            try {
                ScheduledEntry entry = queue.take(); // blocks until the trigger time
                if (entry.generation != generation.get()) continue;
                JobRecord rec = lookup(entry.jobName);
                if (rec == null) continue;

                executor.execute(() -> execute(entry.jobName));

                // cron.next() moves to the following minute, so one fire time never triggers twice
                Instant after = Instant.ofEpochMilli(Math.max(entry.triggerAtMillis, clock.millis()));
                Instant next = rec.cron.next(after).orElse(null);
                rec.nextRun = next;
                if (next != null && running.get() && entry.generation == generation.get()) {
                    queue.offer(new ScheduledEntry(rec.job.getName(), next.toEpochMilli(), entry.generation, clock));
                }
            } catch (InterruptedException ie) {
                if (!running.get() || generation.get() != gen) break;
            } catch (RejectedExecutionException ree) {
                logger.warn("Worker pool rejected a triggered run, dispatcher exiting", ree);
                break;
            } catch (Throwable t) {
                logger.error("Dispatcher error", t);
            }
        }
    }

    /**
     * Execute-by-name path shared by triggers and manual runs.
     */
    JobResult execute(String jobName) {
        JobRecord rec = lookup(jobName);
        if (rec == null) {
            return JobResult.failure("Job \"" + jobName + "\" not found").build();
        }

        if (!runningJobs.add(jobName)) {
            logger.warn("Job \"{}\" is already running, skipping execution", jobName);
            fire(l -> l.onRejected(jobName));
            return JobResult.alreadyRunning();
        }

        try {
            logger.info("Starting job execution: {}", jobName);
            fire(l -> l.onStart(jobName, clock.instant()));

            JobExecution execution = runner.run(rec.job);
            JobResult result = execution.getResult();

            rec.lastRun = execution.getFinishedAt();
            rec.lastDuration = execution.getDuration();
            rec.lastResult = result;

            long millis = execution.getDuration().toMillis();
            if (execution.getError() != null) {
                fire(l -> l.onError(jobName, execution.getError(), result));
            } else if (result.isSuccess()) {
                logger.info("Job completed successfully: {} in {} ms: {} {}", jobName, millis, result.getMessage(), result.getDetails());
            } else {
                logger.warn("Job completed with errors: {} in {} ms: {} {}", jobName, millis, result.getMessage(), result.getDetails());
            }
            fire(l -> l.onComplete(jobName, execution.getStartedAt(), execution.getFinishedAt(), result));
            return result;
        } finally {
            runningJobs.remove(jobName);
        }
    }

    private JobStatus snapshot(JobRecord rec) {
        JobDefinition job = rec.job;
        return new JobStatus(job.getName(), job.getDescription(), job.getSchedule(), job.isEnabled(),
                runningJobs.contains(job.getName()), rec.lastRun, rec.nextRun, rec.lastDuration, rec.lastResult);
    }

    private void fire(Consumer<JobEventListener> c) {
        for (JobEventListener l : listeners) {
            try {
                c.accept(l);
            } catch (Throwable t) {
                logger.warn("Job event listener {} failed", l, t);
            }
        }
    }
}
