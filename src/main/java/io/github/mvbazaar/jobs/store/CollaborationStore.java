package io.github.mvbazaar.jobs.store;

import io.github.mvbazaar.jobs.base_exceptions.StoreException;

import java.util.List;

public interface CollaborationStore {
    List<Collaboration> findByUser(String userId) throws StoreException;
}
