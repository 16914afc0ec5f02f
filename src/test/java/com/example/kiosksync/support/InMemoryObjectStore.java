package com.example.kiosksync.support;

import com.example.kiosksync.model.StoredObject;
import com.example.kiosksync.store.ObjectStore;
import com.example.kiosksync.store.RevisionConflictException;

import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Map-backed object store for tests. {@link #beforeConditionalWrite} lets a test slip a
 * concurrent writer in between a read and a conditional write.
 */
public class InMemoryObjectStore implements ObjectStore {

    private final Map<String, StoredObject> objects = new TreeMap<>();
    private Consumer<String> beforeConditionalWrite = key -> { };
    private Predicate<String> failingPuts = key -> false;
    private boolean failing;

    @Override
    public synchronized Optional<StoredObject> get(String key) {
        checkAvailable();
        StoredObject obj = objects.get(key);
        if (obj == null) return Optional.empty();
        return Optional.of(obj.toBuilder().body(obj.getBody().clone()).build());
    }

    @Override
    public synchronized boolean exists(String key) {
        checkAvailable();
        return objects.containsKey(key);
    }

    @Override
    public synchronized long put(String key, byte[] body, String contentType) {
        checkAvailable();
        if (failingPuts.test(key)) throw new IllegalStateException("write to " + key + " failed");
        StoredObject current = objects.get(key);
        long revision = current == null ? 1L : current.getRevision() + 1;
        objects.put(key, StoredObject.builder()
                .key(key)
                .body(body.clone())
                .contentType(contentType)
                .revision(revision)
                .size(body.length)
                .lastModified(Instant.now())
                .build());
        return revision;
    }

    @Override
    public long putIfRevision(String key, byte[] body, String contentType, long expectedRevision) {
        beforeConditionalWrite.accept(key);
        synchronized (this) {
            checkAvailable();
            StoredObject current = objects.get(key);
            long actual = current == null ? 0L : current.getRevision();
            if (actual != Math.max(0L, expectedRevision)) {
                throw new RevisionConflictException(key, expectedRevision);
            }
            return put(key, body, contentType);
        }
    }

    @Override
    public synchronized boolean delete(String key) {
        checkAvailable();
        return objects.remove(key) != null;
    }

    @Override
    public synchronized List<String> list(String prefix) {
        checkAvailable();
        return objects.keySet().stream().filter(k -> k.startsWith(prefix)).collect(Collectors.toList());
    }

    public void beforeConditionalWrite(Consumer<String> hook) {
        this.beforeConditionalWrite = hook;
    }

    public synchronized void setFailing(boolean failing) {
        this.failing = failing;
    }

    /** Makes writes to matching keys fail while reads and other keys keep working. */
    public synchronized void failPutsTo(Predicate<String> keys) {
        this.failingPuts = keys;
    }

    public synchronized Set<String> keys() {
        return new TreeSet<>(objects.keySet());
    }

    private void checkAvailable() {
        if (failing) throw new IllegalStateException("object store unavailable");
    }
}
