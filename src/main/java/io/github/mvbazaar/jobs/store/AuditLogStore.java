package io.github.mvbazaar.jobs.store;

import io.github.mvbazaar.jobs.base_exceptions.StoreException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public interface AuditLogStore {
    /**
     * Clears user id, IP address and user agent on rows created before {@code cutoff} that still carry any of them.
     * Rows are kept.
     *
     * @return number of rows changed
     */
    int anonymizeCreatedBefore(Instant cutoff) throws StoreException;

    /**
     * Rows created before {@code cutoff} with non-null metadata.
     */
    List<AuditLogEntry> findWithMetadataCreatedBefore(Instant cutoff) throws StoreException;

    void replaceMetadata(String id, Map<String, Object> metadata) throws StoreException;

    int deleteCreatedBefore(Instant cutoff) throws StoreException;

    /**
     * Clears the user id on every row of the user, keeping the rows.
     */
    int detachUser(String userId) throws StoreException;
}
