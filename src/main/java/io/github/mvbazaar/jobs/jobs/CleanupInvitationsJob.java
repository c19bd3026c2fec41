package io.github.mvbazaar.jobs.jobs;

import io.github.mvbazaar.jobs.retention.RetentionPolicies;
import io.github.mvbazaar.jobs.schedulers.JobResult;
import io.github.mvbazaar.jobs.store.InvitationStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Deletes invitations still unresolved 30 days after creation.
 */
public class CleanupInvitationsJob implements MaintenanceJob {
    private final static Logger logger = LoggerFactory.getLogger(CleanupInvitationsJob.class);

    public static final String NAME = "cleanup-invitations";

    private final InvitationStore invitations;
    private final Clock clock;

    public CleanupInvitationsJob(@NotNull InvitationStore invitations, @NotNull Clock clock) {
        this.invitations = Objects.requireNonNull(invitations, "invitations");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public @NotNull String name() {
        return NAME;
    }

    @Override
    public @NotNull String description() {
        return "Delete pending invitations older than " + RetentionPolicies.PENDING_INVITATION_DAYS + " days";
    }

    @Override
    public @NotNull String defaultSchedule() {
        return "0 2 * * *";
    }

    @Override
    public JobResult execute() throws Exception {
        logger.info("Starting cleanup of old pending invitations");
        Instant cutoff = RetentionPolicies.PENDING_INVITATIONS.cutoff(clock.instant());

        int deleted = invitations.deletePendingCreatedBefore(cutoff);

        logger.info("Invitation cleanup completed: deletedCount={}, cutoffDate={}", deleted, cutoff);
        return JobResult.success("Deleted " + deleted + " old pending invitations")
                .detail("deletedCount", deleted)
                .detail("cutoffDate", cutoff.toString())
                .build();
    }
}
