package io.github.mvbazaar.jobs.store;

import io.github.mvbazaar.jobs.base_exceptions.StoreException;

/**
 * Per-user records that never outlive the account.
 */
public interface PersonalDataStore {
    int deleteRefreshTokens(String userId) throws StoreException;

    int deleteConsentRecords(String userId) throws StoreException;

    int deleteNotifications(String userId) throws StoreException;
}
