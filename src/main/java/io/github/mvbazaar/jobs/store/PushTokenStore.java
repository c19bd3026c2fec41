package io.github.mvbazaar.jobs.store;

import io.github.mvbazaar.jobs.base_exceptions.StoreException;

import java.time.Instant;

public interface PushTokenStore {
    int deleteLastUsedBefore(Instant cutoff) throws StoreException;

    int deleteByUser(String userId) throws StoreException;
}
