package io.github.mvbazaar.jobs.store;

import io.github.mvbazaar.jobs.base_exceptions.StoreException;

import java.time.Instant;

public interface InvitationStore {
    /**
     * Deletes invitations created before {@code cutoff} that were neither accepted nor declined.
     *
     * @return number of deleted invitations
     */
    int deletePendingCreatedBefore(Instant cutoff) throws StoreException;
}
