package io.github.mvbazaar.jobs.deletion;

import io.github.mvbazaar.jobs.base_exceptions.DeletionConflictException;
import io.github.mvbazaar.jobs.base_exceptions.DeletionStateException;
import io.github.mvbazaar.jobs.base_exceptions.StoreException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * User-facing side of the account deletion grace period: request, cancel, inspect.
 * Finalization is done by {@link FinalizeDeletionsJob}.
 * <p>
 * A user has at most one PENDING request. Requesting again while one is pending is rejected with
 * {@link DeletionConflictException}; the running grace period is never restarted.
 */
public class DeletionWorkflow {
    private final static Logger logger = LoggerFactory.getLogger(DeletionWorkflow.class);

    private final DeletionRequestStore store;
    private final Clock clock;

    public DeletionWorkflow(@NotNull DeletionRequestStore store, @NotNull Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws DeletionConflictException if the user already has a PENDING request
     */
    public synchronized @NotNull DeletionRequest request(@NotNull String userId, @NotNull DeletionOptions options)
            throws DeletionStateException, StoreException {
        Optional<DeletionRequest> existing = store.findPendingByUser(userId);
        if (existing.isPresent()) {
            throw new DeletionConflictException("User " + userId + " already has a pending deletion request scheduled for "
                    + existing.get().getScheduledFor());
        }
        DeletionRequest request = DeletionRequest.pending(UUID.randomUUID().toString(), userId, clock.instant(), options);
        store.insert(request);
        logger.info("Account deletion scheduled for user {} at {} ({})", userId, request.getScheduledFor(), options);
        return request;
    }

    /**
     * @throws DeletionStateException if the request does not exist or is no longer PENDING
     */
    public synchronized @NotNull DeletionRequest cancel(@NotNull String requestId) throws DeletionStateException, StoreException {
        DeletionRequest request = store.findById(requestId)
                .orElseThrow(() -> new DeletionStateException("Deletion request " + requestId + " not found"));
        return doCancel(request);
    }

    public synchronized @NotNull DeletionRequest cancelForUser(@NotNull String userId) throws DeletionStateException, StoreException {
        DeletionRequest request = store.findPendingByUser(userId)
                .orElseThrow(() -> new DeletionStateException("No pending deletion request for user " + userId));
        return doCancel(request);
    }

    public @NotNull Optional<PendingDeletion> status(@NotNull String userId) throws StoreException {
        return store.findPendingByUser(userId).map(r -> new PendingDeletion(r, clock.instant()));
    }

    private DeletionRequest doCancel(DeletionRequest request) throws DeletionStateException, StoreException {
        DeletionRequest cancelled = request.cancel(clock.instant());
        if (!store.update(request, cancelled)) {
            throw new DeletionStateException("Deletion request " + request.getId() + " changed concurrently, not cancelled");
        }
        logger.info("Account deletion cancelled for user {} (request {})", request.getUserId(), request.getId());
        return cancelled;
    }
}
