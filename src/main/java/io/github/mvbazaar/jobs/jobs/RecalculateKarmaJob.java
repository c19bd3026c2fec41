package io.github.mvbazaar.jobs.jobs;

import io.github.mvbazaar.jobs.schedulers.JobResult;
import io.github.mvbazaar.jobs.store.CollaborationStore;
import io.github.mvbazaar.jobs.store.KarmaCandidate;
import io.github.mvbazaar.jobs.store.UserStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Full karma recalculation for every active user, fixing any drift of the stored value.
 * Users are processed in batches with a pause in between to spread the load on the store.
 * A failure for one user is recorded and the run continues; the result is successful only without failures.
 */
public class RecalculateKarmaJob implements MaintenanceJob {
    private final static Logger logger = LoggerFactory.getLogger(RecalculateKarmaJob.class);

    public static final String NAME = "recalculate-karma";
    public static final int DEFAULT_BATCH_SIZE = 50;
    public static final Duration DEFAULT_BATCH_PAUSE = Duration.ofMillis(100);
    static final int MAX_REPORTED_ERRORS = 10;

    private final UserStore users;
    private final CollaborationStore collaborations;
    private final int batchSize;
    private final Duration batchPause;

    public RecalculateKarmaJob(@NotNull UserStore users, @NotNull CollaborationStore collaborations) {
        this(users, collaborations, DEFAULT_BATCH_SIZE, DEFAULT_BATCH_PAUSE);
    }

    public RecalculateKarmaJob(@NotNull UserStore users, @NotNull CollaborationStore collaborations,
                               int batchSize, @NotNull Duration batchPause) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (batchPause.isNegative()) {
            throw new IllegalArgumentException("batchPause must not be negative: " + batchPause);
        }
        this.users = Objects.requireNonNull(users, "users");
        this.collaborations = Objects.requireNonNull(collaborations, "collaborations");
        this.batchSize = batchSize;
        this.batchPause = batchPause;
    }

    @Override
    public @NotNull String name() {
        return NAME;
    }

    @Override
    public @NotNull String description() {
        return "Full karma recalculation for all users to fix any karma drift";
    }

    @Override
    public @NotNull String defaultSchedule() {
        return "0 5 * * 0";
    }

    @Override
    public JobResult execute() throws Exception {
        logger.info("Starting full karma recalculation for all users");
        List<KarmaCandidate> candidates = users.findKarmaCandidates();
        logger.debug("Found {} users to recalculate karma for", candidates.size());

        int successCount = 0;
        int failureCount = 0;
        long totalKarmaChange = 0;
        List<String> errors = new ArrayList<>();

        int batches = (candidates.size() + batchSize - 1) / batchSize;
        for (int i = 0; i < candidates.size(); i += batchSize) {
            List<KarmaCandidate> batch = candidates.subList(i, Math.min(i + batchSize, candidates.size()));
            logger.debug("Processing batch {} of {}", i / batchSize + 1, batches);

            for (KarmaCandidate user : batch) {
                try {
                    int karma = KarmaCalculator.karma(collaborations.findByUser(user.getUserId()));
                    users.updateKarma(user.getUserId(), karma);

                    int change = karma - user.getKarma();
                    totalKarmaChange += Math.abs(change);
                    if (change != 0) {
                        logger.debug("Updated karma for user {}: {} -> {} ({}{})", user.getUserId(), user.getKarma(), karma,
                                change > 0 ? "+" : "", change);
                    }
                    successCount++;
                } catch (Exception e) {
                    failureCount++;
                    String msg = "Failed to recalculate karma for user " + user.getUserId() + ": " + e.getMessage();
                    errors.add(msg);
                    logger.error(msg, e);
                }
            }

            if (i + batchSize < candidates.size() && !batchPause.isZero()) {
                Thread.sleep(batchPause.toMillis());
            }
        }

        logger.info("Karma recalculation completed: totalUsers={}, successCount={}, failureCount={}, totalKarmaChange={}",
                candidates.size(), successCount, failureCount, totalKarmaChange);
        return JobResult.newBuilder(failureCount == 0)
                .message("Recalculated karma for " + successCount + "/" + candidates.size() + " users (" + failureCount + " failures)")
                .detail("totalUsers", candidates.size())
                .detail("successCount", successCount)
                .detail("failureCount", failureCount)
                .detail("totalKarmaChange", totalKarmaChange)
                .detail("errors", errors.isEmpty() ? null : List.copyOf(errors.subList(0, Math.min(MAX_REPORTED_ERRORS, errors.size()))))
                .build();
    }
}
