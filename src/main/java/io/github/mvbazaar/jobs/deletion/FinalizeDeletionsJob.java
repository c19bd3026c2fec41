package io.github.mvbazaar.jobs.deletion;

import io.github.mvbazaar.jobs.base_exceptions.DeletionStateException;
import io.github.mvbazaar.jobs.base_exceptions.StoreException;
import io.github.mvbazaar.jobs.jobs.MaintenanceJob;
import io.github.mvbazaar.jobs.retention.RetentionPolicies;
import io.github.mvbazaar.jobs.schedulers.JobResult;
import io.github.mvbazaar.jobs.store.AnonymizedProfile;
import io.github.mvbazaar.jobs.store.RetentionStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finalizes account deletions whose grace period has elapsed ({@code scheduledFor <= now}).
 * Depending on the request options the user is either anonymized, keeping their projects, ideas and upvotes
 * under a de-identified label, or deleted with their owned data. Either way the request becomes COMPLETED.
 * One failing request does not stop the others.
 */
public class FinalizeDeletionsJob implements MaintenanceJob {
    private final static Logger logger = LoggerFactory.getLogger(FinalizeDeletionsJob.class);

    public static final String NAME = "finalize-deletions";

    private final RetentionStore store;
    private final Clock clock;

    public FinalizeDeletionsJob(@NotNull RetentionStore store, @NotNull Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public @NotNull String name() {
        return NAME;
    }

    @Override
    public @NotNull String description() {
        return "Execute scheduled user deletions past " + RetentionPolicies.DELETION_GRACE_DAYS + "-day grace period";
    }

    @Override
    public @NotNull String defaultSchedule() {
        return "30 4 * * *";
    }

    @Override
    public JobResult execute() throws Exception {
        logger.info("Starting finalization of scheduled deletions");
        Instant now = clock.instant();

        List<DeletionRequest> due = store.deletionRequests().findPendingDueBy(now);
        logger.debug("Found {} deletion requests to process", due.size());

        int processedCount = 0;
        int anonymizedCount = 0;
        int deletedCount = 0;
        List<String> errors = new ArrayList<>();

        for (DeletionRequest selected : due) {
            try {
                String userId = selected.getUserId();
                boolean userExists = store.users().exists(userId);

                // a cancel may have landed after the selection
                Optional<DeletionRequest> current = store.deletionRequests().findById(selected.getId());
                if (current.isEmpty() || !current.get().isDue(now)) {
                    logger.info("Skipping deletion request {}, no longer due ({})", selected.getId(),
                            current.map(r -> r.getStatus().toString()).orElse("missing"));
                    continue;
                }
                DeletionRequest request = current.get();

                if (!userExists) {
                    logger.info("User {} already gone, completing request {}", userId, request.getId());
                } else if (request.getOptions().isAnonymizeContributions()) {
                    anonymize(userId, now);
                    anonymizedCount++;
                } else {
                    deleteFully(userId);
                    deletedCount++;
                }
                if (!store.deletionRequests().update(request, request.complete(now))) {
                    String msg = "Deletion request " + request.getId() + " for user " + userId + " changed while being finalized";
                    errors.add(msg);
                    logger.error(msg);
                    continue;
                }
                processedCount++;
            } catch (StoreException | DeletionStateException | RuntimeException e) {
                String msg = "Failed to process deletion for user " + selected.getUserId() + ": " + e.getMessage();
                errors.add(msg);
                logger.error(msg, e);
            }
        }

        logger.info("Deletion finalization completed: totalRequests={}, processedCount={}, anonymizedCount={}, deletedCount={}, errors={}",
                due.size(), processedCount, anonymizedCount, deletedCount, errors.size());
        return JobResult.newBuilder(errors.isEmpty())
                .message("Processed " + processedCount + " deletion requests (" + anonymizedCount + " anonymized, " + deletedCount + " deleted)")
                .detail("totalRequests", due.size())
                .detail("processedCount", processedCount)
                .detail("anonymizedCount", anonymizedCount)
                .detail("deletedCount", deletedCount)
                .detail("gracePeriodDays", RetentionPolicies.DELETION_GRACE_DAYS)
                .detail("errors", errors.isEmpty() ? null : List.copyOf(errors))
                .build();
    }

    private void anonymize(String userId, Instant now) throws StoreException {
        logger.info("Anonymizing user: {}", userId);
        store.users().anonymize(userId, AnonymizedProfile.forUser(userId, now));
        store.auditLogs().detachUser(userId);
        store.pushTokens().deleteByUser(userId);
        store.personalData().deleteRefreshTokens(userId);
        store.personalData().deleteConsentRecords(userId);
    }

    private void deleteFully(String userId) throws StoreException {
        logger.info("Deleting user: {}", userId);
        store.personalData().deleteNotifications(userId);
        store.pushTokens().deleteByUser(userId);
        store.personalData().deleteRefreshTokens(userId);
        store.personalData().deleteConsentRecords(userId);
        store.auditLogs().detachUser(userId);
        store.users().delete(userId);
    }
}
