package io.github.mvbazaar.jobs.jobs;

import io.github.mvbazaar.jobs.retention.RetentionPolicies;
import io.github.mvbazaar.jobs.schedulers.JobResult;
import io.github.mvbazaar.jobs.store.PushTokenStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

public class CleanupPushTokensJob implements MaintenanceJob {
    private final static Logger logger = LoggerFactory.getLogger(CleanupPushTokensJob.class);

    public static final String NAME = "cleanup-push-tokens";

    private final PushTokenStore pushTokens;
    private final Clock clock;

    public CleanupPushTokensJob(@NotNull PushTokenStore pushTokens, @NotNull Clock clock) {
        this.pushTokens = Objects.requireNonNull(pushTokens, "pushTokens");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public @NotNull String name() {
        return NAME;
    }

    @Override
    public @NotNull String description() {
        return "Delete push tokens not used in " + RetentionPolicies.PUSH_TOKEN_INACTIVE_DAYS + " days";
    }

    @Override
    public @NotNull String defaultSchedule() {
        return "30 2 * * *";
    }

    @Override
    public JobResult execute() throws Exception {
        logger.info("Starting cleanup of inactive push tokens");
        Instant cutoff = RetentionPolicies.INACTIVE_PUSH_TOKENS.cutoff(clock.instant());

        int deleted = pushTokens.deleteLastUsedBefore(cutoff);

        logger.info("Push token cleanup completed: deletedCount={}, cutoffDate={}", deleted, cutoff);
        return JobResult.success("Deleted " + deleted + " inactive push tokens")
                .detail("deletedCount", deleted)
                .detail("cutoffDate", cutoff.toString())
                .detail("inactiveDays", RetentionPolicies.PUSH_TOKEN_INACTIVE_DAYS)
                .build();
    }
}
