package com.example.kiosksync.service;

import com.example.kiosksync.error.DuplicateEntityException;
import com.example.kiosksync.error.InvalidRequestException;
import com.example.kiosksync.error.NotFoundException;
import com.example.kiosksync.error.ReservedIdentifierException;
import com.example.kiosksync.model.*;
import com.example.kiosksync.store.ObjectStore;
import com.example.kiosksync.sync.EntityKind;
import com.example.kiosksync.sync.VersionClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.*;

/**
 * Backend-side persistence of one entity type: bodies under {@code {type}s/{id}/{id}.json},
 * versions in the type's {@link VersionManifestStore}.
 * <p>
 * Each body carries the version it was written at, so a reader that races a writer gets a
 * body and version that belong together and simply pulls again on the next sync. A body write
 * that fails reverts the manifest entry it was issued under.
 */
public class EntityStoreService<T extends SyncEntity> {

    private static final Logger logger = LoggerFactory.getLogger(EntityStoreService.class);

    private static final String VERSION_FIELD = "version";

    private final EntityKind<T> kind;
    private final ObjectStore store;
    private final VersionManifestStore manifest;
    private final ObjectMapper mapper;
    private final VersionClock versions;

    public EntityStoreService(EntityKind<T> kind, ObjectStore store, VersionManifestStore manifest,
                              ObjectMapper mapper, VersionClock versions) {
        this.kind = kind;
        this.store = store;
        this.manifest = manifest;
        this.mapper = mapper;
        this.versions = versions;
    }

    public EntityKind<T> kind() {
        return kind;
    }

    /**
     * Stores a new record. A record without an id gets one derived from its name.
     *
     * @return the issued version
     */
    public long create(T entity) {
        if (entity.getName() == null || entity.getName().isBlank()) {
            throw new InvalidRequestException("Missing required field: name");
        }
        if (entity.getId() == null || entity.getId().isBlank()) {
            entity.setId(kind.newId(entity.getName(), versions.millis()));
        }
        String id = entity.getId();
        if (kind.isReserved(id)) {
            throw new ReservedIdentifierException(entity.getName(), id);
        }
        if (store.exists(kind.objectKey(id))) {
            throw new DuplicateEntityException(kind.getName(), id);
        }

        Instant now = versions.now();
        if (entity.getCreatedAt() == null) entity.setCreatedAt(now);
        if (entity.getLastEditedAt() == null) entity.setLastEditedAt(entity.getCreatedAt());
        kind.initialize(entity);

        long version = manifest.recordWrite(id, Boolean.TRUE.equals(entity.getPublished()), 0L);
        writeBody(entity, version, null);
        logger.info("Created {} {} at v{}", kind, id, version);
        return version;
    }

    /**
     * Merges the non-null fields of {@code changes} into the stored record. Id and creation
     * audit fields never change.
     */
    public long edit(String id, T changes, long expectedVersion) {
        RemoteEntity<T> stored = fetch(id).orElseThrow(() -> new NotFoundException(kind.getName(), id));
        T existing = stored.getEntity();
        ManifestEntry previous = new ManifestEntry(stored.getVersion(), Boolean.TRUE.equals(existing.getPublished()));
        Instant createdAt = existing.getCreatedAt();
        String createdBy = existing.getCreatedBy();

        // updateValue merges into existing in place
        T merged = merge(existing, changes);
        merged.setId(id);
        merged.setCreatedAt(createdAt);
        merged.setCreatedBy(createdBy);
        merged.setLastEditedAt(versions.now());

        long version = manifest.recordWrite(id, Boolean.TRUE.equals(merged.getPublished()), expectedVersion);
        writeBody(merged, version, previous);
        logger.info("Updated {} {} to v{} (expected v{})", kind, id, version, expectedVersion);
        return version;
    }

    public Optional<RemoteEntity<T>> fetch(String id) {
        if (kind.isReserved(id)) return Optional.empty();
        Optional<StoredObject> obj = store.get(kind.objectKey(id));
        if (obj.isEmpty() || obj.get().getBody() == null) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(obj.get().getBody());
            long version = node.path(VERSION_FIELD).asLong(0L);
            if (version == 0L) {
                version = manifest.versionOf(id);
            }
            T entity = mapper.treeToValue(node, kind.getType());
            return Optional.of(new RemoteEntity<>(entity, version));
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable " + kind + " body " + id, e);
        }
    }

    public void delete(String id) {
        String key = kind.objectKey(id);
        if (kind.isReserved(id) || !store.exists(key)) {
            throw new NotFoundException(kind.getName(), id);
        }
        store.delete(key);
        manifest.remove(id);
        logger.info("Deleted {} {}", kind, id);
    }

    /**
     * Compares the caller's versions with the manifest. Ids the manifest holds at a newer
     * version need updating; those of them the caller reports as dirty are conflicts.
     */
    public ReconcileResult reconcile(Map<String, Long> localVersions, Collection<String> dirtyIds) {
        VersionManifest current = manifest.read();
        Set<String> dirty = dirtyIds == null ? Set.of() : new HashSet<>(dirtyIds);
        Map<String, Long> local = localVersions == null ? Map.of() : localVersions;

        List<String> needsUpdate = new ArrayList<>();
        List<String> conflicts = new ArrayList<>();
        for (Map.Entry<String, ManifestEntry> e : current.getEntries().entrySet()) {
            long localVersion = Optional.ofNullable(local.get(e.getKey())).orElse(0L);
            if (e.getValue().getVersion() > localVersion) {
                needsUpdate.add(e.getKey());
                if (dirty.contains(e.getKey())) {
                    conflicts.add(e.getKey());
                }
            }
        }
        return new ReconcileResult(needsUpdate, conflicts, new LinkedHashMap<>(current.getEntries()));
    }

    public VersionManifest manifest() {
        return manifest.read();
    }

    private T merge(T existing, T changes) {
        if (changes == null) return existing;
        try {
            return mapper.updateValue(existing, changes);
        } catch (IOException e) {
            throw new InvalidRequestException("Cannot apply changes to " + kind + " " + existing.getId() + ": " + e.getMessage());
        }
    }

    /**
     * Writes the body of a version the manifest already issued. On failure the manifest entry
     * goes back to {@code previous} so it never names a version no body carries.
     */
    private void writeBody(T entity, long version, ManifestEntry previous) {
        try {
            putBody(entity, version);
        } catch (RuntimeException e) {
            logger.error("Writing {} {} v{} failed, reverting its manifest entry", kind, entity.getId(), version, e);
            try {
                manifest.revertWrite(entity.getId(), version, previous);
            } catch (RuntimeException revertFailure) {
                logger.error("Manifest entry of {} {} left at v{}", kind, entity.getId(), version, revertFailure);
                e.addSuppressed(revertFailure);
            }
            throw e;
        }
    }

    private void putBody(T entity, long version) {
        ObjectNode node = mapper.valueToTree(entity);
        node.put(VERSION_FIELD, version);
        try {
            store.put(kind.objectKey(entity.getId()), mapper.writeValueAsBytes(node), ObjectStore.JSON);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialize " + kind + " " + entity.getId(), e);
        }
    }
}
