package io.github.mvbazaar.jobs;

import io.github.mvbazaar.jobs.base_exceptions.JobConfigurationException;
import io.github.mvbazaar.jobs.deletion.FinalizeDeletionsJob;
import io.github.mvbazaar.jobs.jobs.AnonymizeAuditLogsJob;
import io.github.mvbazaar.jobs.jobs.CleanupInvitationsJob;
import io.github.mvbazaar.jobs.jobs.CleanupOrphanedFilesJob;
import io.github.mvbazaar.jobs.jobs.CleanupPushTokensJob;
import io.github.mvbazaar.jobs.jobs.DeleteAuditLogsJob;
import io.github.mvbazaar.jobs.jobs.MaintenanceJob;
import io.github.mvbazaar.jobs.jobs.RecalculateKarmaJob;
import io.github.mvbazaar.jobs.schedulers.JobEventListener;
import io.github.mvbazaar.jobs.schedulers.JobScheduler;
import io.github.mvbazaar.jobs.store.RetentionStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Entry point used by the host at startup: builds the scheduler, registers the maintenance jobs and
 * optionally starts it. The returned scheduler belongs to the caller, who must {@code close()} it on shutdown.
 * <pre>{@code
 * JobScheduler scheduler = JobsSetup.setup(store, JobsConfiguration.newBuilder()
 *         .uploadsRoot(Path.of("/var/uploads"))
 *         .build());
 * ...
 * scheduler.close();
 * }</pre>
 */
public final class JobsSetup {
    private final static Logger logger = LoggerFactory.getLogger(JobsSetup.class);

    private JobsSetup() {
    }

    /**
     * Registers all jobs and starts the scheduler when {@link JobsConfiguration#isAutoStart()} is set.
     *
     * @throws JobConfigurationException on a bad schedule, a duplicate name or an override for an unknown job
     */
    public static @NotNull JobScheduler setup(@NotNull RetentionStore store, @NotNull JobsConfiguration config)
            throws JobConfigurationException {
        JobScheduler scheduler = create(store, config);
        if (config.isAutoStart()) {
            scheduler.start();
        }
        return scheduler;
    }

    /**
     * Same as {@link #setup(RetentionStore, JobsConfiguration)} but never starts the scheduler.
     */
    public static @NotNull JobScheduler create(@NotNull RetentionStore store, @NotNull JobsConfiguration config)
            throws JobConfigurationException {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(config, "config");

        List<MaintenanceJob> jobs = jobs(store, config);
        List<String> names = jobs.stream().map(MaintenanceJob::name).collect(Collectors.toList());
        for (String overridden : config.overriddenJobNames()) {
            if (!names.contains(overridden)) {
                throw new JobConfigurationException("Configuration refers to unknown job: " + overridden);
            }
        }

        JobScheduler.Builder builder = new JobScheduler.Builder();
        for (JobEventListener listener : config.getListeners()) {
            builder.addListener(listener);
        }
        JobScheduler scheduler = builder.build();

        for (MaintenanceJob job : jobs) {
            String schedule = config.scheduleOverride(job.name()).orElse(job.defaultSchedule());
            Boolean enabled = config.enabledOverride(job.name());
            scheduler.register(job.definition(schedule, enabled == null || enabled));
        }
        logger.info("Registered {} jobs with scheduler: {}", jobs.size(), names);
        return scheduler;
    }

    /**
     * The maintenance jobs, each closed over the collaborators it needs.
     */
    public static @NotNull List<MaintenanceJob> jobs(@NotNull RetentionStore store, @NotNull JobsConfiguration config) {
        Clock clock = config.getClock();
        return List.of(
                new CleanupInvitationsJob(store.invitations(), clock),
                new CleanupPushTokensJob(store.pushTokens(), clock),
                new AnonymizeAuditLogsJob(store.auditLogs(), clock),
                new DeleteAuditLogsJob(store.auditLogs(), clock),
                new CleanupOrphanedFilesJob(store.uploads(), config.getUploadsRoot(), clock),
                new FinalizeDeletionsJob(store, clock),
                new RecalculateKarmaJob(store.users(), store.collaborations(), config.getKarmaBatchSize(), config.getKarmaBatchPause())
        );
    }
}
