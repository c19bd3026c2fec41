package io.github.mvbazaar.jobs.store;

import io.github.mvbazaar.jobs.base_exceptions.StoreException;

import java.util.List;

public interface UserStore {
    boolean exists(String userId) throws StoreException;

    /**
     * Users that are neither deleted nor anonymized, in a stable order.
     */
    List<KarmaCandidate> findKarmaCandidates() throws StoreException;

    void updateKarma(String userId, int karma) throws StoreException;

    /**
     * Overwrites the identifying fields of the user with {@code profile}. Authored content stays attached.
     */
    void anonymize(String userId, AnonymizedProfile profile) throws StoreException;

    /**
     * Deletes the user; owned collaborations, ideas and upvotes cascade.
     */
    void delete(String userId) throws StoreException;
}
