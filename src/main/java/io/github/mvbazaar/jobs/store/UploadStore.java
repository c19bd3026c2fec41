package io.github.mvbazaar.jobs.store;

import io.github.mvbazaar.jobs.base_exceptions.StoreException;

import java.time.Instant;
import java.util.List;

public interface UploadStore {
    List<Upload> findCreatedBefore(Instant cutoff) throws StoreException;

    /**
     * Number of entities (user avatars, project images) pointing at {@code publicUrl}.
     */
    int countReferences(String publicUrl) throws StoreException;

    void delete(String uploadId) throws StoreException;
}
