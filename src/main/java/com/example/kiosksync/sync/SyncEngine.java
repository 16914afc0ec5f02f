package com.example.kiosksync.sync;

import com.example.kiosksync.cache.LocalCache;
import com.example.kiosksync.error.RemoteUnavailableException;
import com.example.kiosksync.error.SyncException;
import com.example.kiosksync.gateway.EntityGateway;
import com.example.kiosksync.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Brings one entity type's local cache in line with the backend manifest.
 */
public class SyncEngine<T extends SyncEntity> {

    private static final Logger logger = LoggerFactory.getLogger(SyncEngine.class);

    private final LocalCache<T> cache;
    private final EntityGateway<T> gateway;

    public SyncEngine(LocalCache<T> cache, EntityGateway<T> gateway) {
        this.cache = cache;
        this.gateway = gateway;
    }

    public LocalCache<T> cache() {
        return cache;
    }

    /**
     * Reconciles and returns the refreshed local view.
     * <ul>
     *   <li>cached ids missing from the manifest were deleted remotely and are evicted, except
     *       records that never reached the backend</li>
     *   <li>ids the backend holds at a newer version are pulled and cached clean, unless the
     *       local copy is dirty; those are reported as conflicts instead</li>
     *   <li>when the backend is unreachable the cached view is returned unchanged</li>
     * </ul>
     */
    public SyncReport<T> list() {
        List<VersionedRecord<T>> local = cache.listAll();
        Map<String, VersionedRecord<T>> byId = new LinkedHashMap<>();
        local.forEach(r -> byId.put(r.id(), r));

        Map<String, Long> localVersions = new LinkedHashMap<>();
        List<String> dirtyIds = new ArrayList<>();
        for (VersionedRecord<T> r : local) {
            localVersions.put(r.id(), r.getRemoteVersion());
            if (r.isDirty()) dirtyIds.add(r.id());
        }

        ReconcileResult result;
        try {
            result = gateway.reconcile(localVersions, dirtyIds);
        } catch (RemoteUnavailableException e) {
            logger.warn("{} sync offline, serving {} cached records: {}", cache.kind(), local.size(), e.getMessage());
            return SyncReport.offline(local);
        }

        Set<String> serverIds = result.getServerVersions().keySet();
        List<String> removed = new ArrayList<>();
        for (VersionedRecord<T> r : local) {
            if (serverIds.contains(r.id())) continue;
            if (r.getRemoteVersion() == 0L) {
                // created offline, not pushed yet
                continue;
            }
            cache.evict(r.id());
            removed.add(r.id());
        }

        Set<String> conflicts = new LinkedHashSet<>(result.getConflicts());
        List<String> pulled = new ArrayList<>();
        for (String id : result.getNeedsUpdate()) {
            VersionedRecord<T> current = byId.get(id);
            if (current != null && current.isDirty()) {
                logger.warn("{} {} changed remotely while it has unsaved local edits", cache.kind(), id);
                conflicts.add(id);
                continue;
            }
            try {
                Optional<RemoteEntity<T>> remote = gateway.fetch(id);
                if (remote.isPresent()) {
                    cache.storeClean(remote.get());
                    pulled.add(id);
                } else {
                    logger.debug("{} {} listed in manifest but has no body, skipped", cache.kind(), id);
                }
            } catch (SyncException e) {
                logger.warn("Pulling {} {} failed, keeping cached copy: {}", cache.kind(), id, e.getMessage());
            }
        }

        logger.info("{} sync: {} pulled, {} removed, {} conflicts", cache.kind(), pulled.size(), removed.size(), conflicts.size());
        List<VersionedRecord<T>> records = cache.listAll().stream()
                .sorted(Comparator.comparing((VersionedRecord<T> r) -> r.id()))
                .collect(Collectors.toList());
        return SyncReport.<T>builder()
                .records(records)
                .pulled(pulled)
                .removed(removed)
                .conflicts(new ArrayList<>(conflicts))
                .offline(false)
                .build();
    }
}
