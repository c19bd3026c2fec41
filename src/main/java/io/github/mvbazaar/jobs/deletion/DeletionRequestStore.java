package io.github.mvbazaar.jobs.deletion;

import io.github.mvbazaar.jobs.base_exceptions.StoreException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DeletionRequestStore {
    Optional<DeletionRequest> findById(String id) throws StoreException;

    Optional<DeletionRequest> findPendingByUser(String userId) throws StoreException;

    /**
     * PENDING requests with {@code scheduledFor <= now}.
     */
    List<DeletionRequest> findPendingDueBy(Instant now) throws StoreException;

    void insert(DeletionRequest request) throws StoreException;

    /**
     * Replaces the stored request with {@code next} only if it still equals {@code expected}.
     *
     * @return false if the stored request changed since {@code expected} was read, or is gone
     */
    boolean update(DeletionRequest expected, DeletionRequest next) throws StoreException;
}
