package com.example.kiosksync.sync;

import com.example.kiosksync.cache.LocalCache;
import com.example.kiosksync.model.SyncEntity;
import com.example.kiosksync.service.EntityStoreService;

/**
 * The wired components of one entity type: backend store, edge cache and sync engine.
 */
public class EntityModule<T extends SyncEntity> {

    private final EntityKind<T> kind;
    private final EntityStoreService<T> store;
    private final LocalCache<T> cache;
    private final SyncEngine<T> engine;

    public EntityModule(EntityKind<T> kind, EntityStoreService<T> store, LocalCache<T> cache, SyncEngine<T> engine) {
        this.kind = kind;
        this.store = store;
        this.cache = cache;
        this.engine = engine;
    }

    public EntityKind<T> getKind() { return kind; }
    public EntityStoreService<T> getStore() { return store; }
    public LocalCache<T> getCache() { return cache; }
    public SyncEngine<T> getEngine() { return engine; }
}
