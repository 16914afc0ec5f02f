package com.example.kiosksync.cache;

import com.example.kiosksync.error.DuplicateEntityException;
import com.example.kiosksync.error.NotFoundException;
import com.example.kiosksync.error.RemoteUnavailableException;
import com.example.kiosksync.gateway.EntityGateway;
import com.example.kiosksync.kv.KvClient;
import com.example.kiosksync.model.CacheStatus;
import com.example.kiosksync.model.RemoteEntity;
import com.example.kiosksync.model.SyncEntity;
import com.example.kiosksync.model.VersionedRecord;
import com.example.kiosksync.sync.EntityKind;
import com.example.kiosksync.sync.VersionClock;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Edge-side cache of one entity type, stored in the local KV under {@code {type}:record:{id}}.
 * <p>
 * Local mutations never need the backend: they advance {@code localVersion} and mark the record
 * dirty. Only {@link #save}, {@link #delete} and {@link #add} talk to the gateway, and a failed
 * remote call never loses the local copy.
 */
public class LocalCache<T extends SyncEntity> {

    private static final Logger logger = LoggerFactory.getLogger(LocalCache.class);

    private static final Set<String> PROTECTED_FIELDS = Set.of("id", "createdAt", "createdBy");

    private final EntityKind<T> kind;
    private final KvClient kv;
    private final EntityGateway<T> gateway;
    private final ObjectMapper mapper;
    private final VersionClock versions;
    private final CreatePolicy createPolicy;
    private final JavaType recordType;

    public LocalCache(EntityKind<T> kind, KvClient kv, EntityGateway<T> gateway, ObjectMapper mapper,
                      VersionClock versions, CreatePolicy createPolicy) {
        this.kind = kind;
        this.kv = kv;
        this.gateway = gateway;
        this.mapper = mapper;
        this.versions = versions;
        this.createPolicy = createPolicy;
        this.recordType = mapper.getTypeFactory().constructParametricType(VersionedRecord.class, kind.getType());
    }

    public EntityKind<T> kind() {
        return kind;
    }

    public Optional<VersionedRecord<T>> get(String id) {
        return kv.get(kind.cacheKey(id)).map(this::decode);
    }

    public void put(VersionedRecord<T> record) {
        kv.set(kind.cacheKey(record.id()), encode(record));
    }

    /** Drops the local copy only. */
    public void evict(String id) {
        kv.del(kind.cacheKey(id));
        logger.debug("Evicted {} {} from local cache", kind, id);
    }

    public List<VersionedRecord<T>> listAll() {
        List<String> keys = kv.scanAll(kind.cachePrefix());
        if (keys.isEmpty()) return new ArrayList<>();
        return kv.mget(keys).values().stream()
                .filter(Objects::nonNull)
                .map(this::decode)
                .collect(Collectors.toList());
    }

    /** Last version the backend confirmed for every cached id. */
    public Map<String, Long> localVersions() {
        Map<String, Long> result = new LinkedHashMap<>();
        for (VersionedRecord<T> record : listAll()) {
            result.put(record.id(), record.getRemoteVersion());
        }
        return result;
    }

    /**
     * Merges the non-null values of {@code changes} into the cached entity and marks it dirty.
     * Id and creation audit fields are ignored. A null value leaves the field as it was, the same
     * way the backend merges an edit.
     *
     * @throws NotFoundException when the id is not cached
     */
    public VersionedRecord<T> updateLocal(String id, Map<String, Object> changes) {
        VersionedRecord<T> record = require(id);
        Map<String, Object> applicable = new LinkedHashMap<>(changes == null ? Map.of() : changes);
        applicable.keySet().removeAll(PROTECTED_FIELDS);
        applicable.values().removeIf(Objects::isNull);

        T entity = mapper.convertValue(record.getEntity(), kind.getType());
        try {
            entity = mapper.updateValue(entity, applicable);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot apply changes to " + kind + " " + id + ": " + e.getMessage(), e);
        }
        entity.setId(id);
        entity.setLastEditedAt(versions.now());

        VersionedRecord<T> updated = record.toBuilder()
                .entity(entity)
                .localVersion(versions.next(record.getLocalVersion()))
                .dirty(true)
                .build();
        put(updated);
        logger.debug("Local edit of {} {} -> local v{}", kind, id, updated.getLocalVersion());
        return updated;
    }

    /**
     * Pushes a dirty record to the backend. A clean record is returned as is without a remote
     * call. On failure the dirty record stays cached and the exception propagates.
     */
    public VersionedRecord<T> save(String id) {
        VersionedRecord<T> record = require(id);
        if (!record.isDirty()) {
            return record;
        }

        long version;
        try {
            version = push(record);
        } catch (RuntimeException e) {
            logger.error("Saving {} {} failed, local edits kept", kind, id, e);
            throw e;
        }

        VersionedRecord<T> saved = record.toBuilder().remoteVersion(version).dirty(false).build();
        put(saved);
        logger.info("Saved {} {} at remote v{}", kind, id, version);
        return saved;
    }

    /**
     * Creates a record from a draft: the id comes from the name, the record is cached dirty
     * before the backend is asked to create it.
     */
    public VersionedRecord<T> add(T draft) {
        String id = kind.newId(draft.getName(), versions.millis());
        if (get(id).isPresent()) {
            throw new DuplicateEntityException(kind.getName(), id);
        }
        draft.setId(id);
        if (draft.getCreatedAt() == null) draft.setCreatedAt(versions.now());
        draft.setLastEditedAt(draft.getCreatedAt());
        kind.initialize(draft);

        VersionedRecord<T> record = new VersionedRecord<>(draft, versions.next(0L), 0L, true);
        put(record);

        try {
            long version = gateway.create(draft);
            VersionedRecord<T> created = record.toBuilder().remoteVersion(version).dirty(false).build();
            put(created);
            logger.info("Created {} {} at remote v{}", kind, id, version);
            return created;
        } catch (RemoteUnavailableException e) {
            if (createPolicy == CreatePolicy.REMOTE_CONFIRMED) {
                logger.error("Creating {} {} failed, kept locally as dirty", kind, id, e);
                throw e;
            }
            logger.warn("Backend unreachable, {} {} kept locally until the next save: {}", kind, id, e.getMessage());
            return record;
        } catch (RuntimeException e) {
            // rejected by the backend: the name is taken or invalid
            evict(id);
            throw e;
        }
    }

    /**
     * Deletes remotely, then locally. A record the backend no longer knows is dropped locally
     * too; any other failure leaves the local copy in place.
     */
    public void delete(String id) {
        Optional<VersionedRecord<T>> local = get(id);
        try {
            gateway.delete(id);
        } catch (NotFoundException e) {
            if (local.isEmpty()) throw e;
            logger.info("{} {} already gone remotely, dropping local copy", kind, id);
        }
        evict(id);
        logger.info("Deleted {} {}", kind, id);
    }

    /**
     * Discards local edits by replacing the cached record with the backend's copy.
     *
     * @return the clean record, or empty when the backend does not know the id
     */
    public Optional<VersionedRecord<T>> revertToRemote(String id) {
        Optional<RemoteEntity<T>> remote = gateway.fetch(id);
        if (remote.isEmpty()) {
            logger.debug("No remote copy of {} {} to revert to", kind, id);
            return Optional.empty();
        }
        VersionedRecord<T> record = storeClean(remote.get());
        logger.info("Reverted {} {} to remote v{}", kind, id, record.getRemoteVersion());
        return Optional.of(record);
    }

    public VersionedRecord<T> togglePublish(String id, boolean published) {
        updateLocal(id, Map.of("published", published));
        return save(id);
    }

    public CacheStatus status() {
        List<VersionedRecord<T>> records = listAll();
        int dirty = (int) records.stream().filter(VersionedRecord::isDirty).count();
        return new CacheStatus(records.size(), dirty, records.size() - dirty);
    }

    /** Caches a backend copy as a clean record. */
    public VersionedRecord<T> storeClean(RemoteEntity<T> remote) {
        VersionedRecord<T> record = new VersionedRecord<>(remote.getEntity(), remote.getVersion(), remote.getVersion(), false);
        put(record);
        return record;
    }

    private long push(VersionedRecord<T> record) {
        if (record.getRemoteVersion() > 0) {
            return gateway.edit(record.id(), record.getEntity(), record.getRemoteVersion());
        }
        // never acknowledged: created offline
        try {
            return gateway.create(record.getEntity());
        } catch (DuplicateEntityException e) {
            logger.debug("{} {} exists remotely already, editing instead", kind, record.id());
            return gateway.edit(record.id(), record.getEntity(), 0L);
        }
    }

    private VersionedRecord<T> require(String id) {
        return get(id).orElseThrow(() -> new NotFoundException(kind.getName(), id));
    }

    private VersionedRecord<T> decode(String json) {
        try {
            return mapper.readValue(json, recordType);
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt " + kind + " cache entry", e);
        }
    }

    private String encode(VersionedRecord<T> record) {
        try {
            return mapper.writeValueAsString(record);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialize " + kind + " " + record.id(), e);
        }
    }
}
