package com.example.kiosksync.gateway;

import com.example.kiosksync.error.RemoteUnavailableException;
import com.example.kiosksync.error.SyncException;
import com.example.kiosksync.model.ReconcileResult;
import com.example.kiosksync.model.RemoteEntity;
import com.example.kiosksync.model.SyncEntity;
import com.example.kiosksync.service.EntityStoreService;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Gateway for edge and backend running in one process. Hands the service a copy of the
 * entity, the way a serialized request would.
 */
public class EmbeddedEntityGateway<T extends SyncEntity> implements EntityGateway<T> {

    private final EntityStoreService<T> service;
    private final ObjectMapper mapper;

    public EmbeddedEntityGateway(EntityStoreService<T> service, ObjectMapper mapper) {
        this.service = service;
        this.mapper = mapper;
    }

    @Override
    public long create(T entity) {
        return call("create " + entity.getId(), () -> service.create(copy(entity)));
    }

    @Override
    public long edit(String id, T entity, long expectedVersion) {
        return call("edit " + id, () -> service.edit(id, copy(entity), expectedVersion));
    }

    @Override
    public Optional<RemoteEntity<T>> fetch(String id) {
        return call("fetch " + id, () -> service.fetch(id));
    }

    @Override
    public void delete(String id) {
        call("delete " + id, () -> {
            service.delete(id);
            return null;
        });
    }

    @Override
    public ReconcileResult reconcile(Map<String, Long> localVersions, Collection<String> dirtyIds) {
        return call("reconcile", () -> service.reconcile(localVersions, dirtyIds));
    }

    private T copy(T entity) {
        return mapper.convertValue(entity, service.kind().getType());
    }

    private <R> R call(String what, Supplier<R> action) {
        try {
            return action.get();
        } catch (SyncException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RemoteUnavailableException(service.kind() + " " + what + " failed: " + e.getMessage(), e);
        }
    }
}
