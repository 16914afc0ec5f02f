package com.example.kiosksync.gateway;

import com.example.kiosksync.model.ReconcileResult;
import com.example.kiosksync.model.RemoteEntity;
import com.example.kiosksync.model.SyncEntity;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Calls into the backend persistence API for one entity type. Implementations are stateless
 * and translate every transport problem into
 * {@link com.example.kiosksync.error.RemoteUnavailableException}.
 */
public interface EntityGateway<T extends SyncEntity> {

    /** @return the version the backend issued */
    long create(T entity);

    /**
     * @param expectedVersion the remote version the edit is based on; {@code 0} skips the check
     * @return the version the backend issued
     * @throws com.example.kiosksync.error.VersionConflictException when the backend holds a newer version
     */
    long edit(String id, T entity, long expectedVersion);

    Optional<RemoteEntity<T>> fetch(String id);

    void delete(String id);

    ReconcileResult reconcile(Map<String, Long> localVersions, Collection<String> dirtyIds);
}
