package com.example.kiosksync.store;

import com.example.kiosksync.model.StoredObject;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * A single shared JSON document in the object store that several processes read-modify-write.
 * <p>
 * Every {@link #update} is a compare-and-swap on the object revision: when another writer got
 * in between the read and the write, the mutation is replayed on the fresh copy, up to
 * {@code maxAttempts} times.
 */
public class JsonDocument<D> {

    private static final Logger logger = LoggerFactory.getLogger(JsonDocument.class);

    private final ObjectStore store;
    private final ObjectMapper mapper;
    private final String key;
    private final JavaType type;
    private final Supplier<D> initial;
    private final int maxAttempts;

    public JsonDocument(ObjectStore store, ObjectMapper mapper, String key, JavaType type,
                        Supplier<D> initial, int maxAttempts) {
        this.store = store;
        this.mapper = mapper;
        this.key = key;
        this.type = type;
        this.initial = initial;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public String key() {
        return key;
    }

    /**
     * Current content, or the initial value when the document was never written.
     */
    public D read() {
        return load().value;
    }

    /**
     * Like {@link #read()} but persists the initial value when the document is absent.
     */
    public D readOrCreate() {
        Snapshot<D> snapshot = load();
        if (snapshot.revision > 0) {
            return snapshot.value;
        }
        try {
            store.putIfRevision(key, encode(snapshot.value), ObjectStore.JSON, 0L);
            logger.info("Created {}", key);
            return snapshot.value;
        } catch (RevisionConflictException e) {
            // someone else created it meanwhile
            return read();
        }
    }

    /**
     * Applies {@code mutation} to the latest content and writes it back conditionally.
     *
     * @return the document as written
     * @throws RevisionConflictException when every attempt lost the race
     */
    public D update(UnaryOperator<D> mutation) {
        RevisionConflictException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Snapshot<D> snapshot = load();
            D next = mutation.apply(snapshot.value);
            try {
                store.putIfRevision(key, encode(next), ObjectStore.JSON, snapshot.revision);
                return next;
            } catch (RevisionConflictException e) {
                last = e;
                logger.debug("Concurrent write on {} (attempt {}/{}), retrying", key, attempt, maxAttempts);
            }
        }
        logger.warn("Giving up on {} after {} conflicting attempts", key, maxAttempts);
        throw last;
    }

    private Snapshot<D> load() {
        Optional<StoredObject> obj = store.get(key);
        if (obj.isEmpty() || obj.get().getBody() == null) {
            return new Snapshot<>(initial.get(), 0L);
        }
        try {
            D value = mapper.readValue(obj.get().getBody(), type);
            return new Snapshot<>(value, obj.get().getRevision());
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable document " + key, e);
        }
    }

    private byte[] encode(D value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialize document " + key, e);
        }
    }

    private static final class Snapshot<D> {
        private final D value;
        private final long revision;

        private Snapshot(D value, long revision) {
            this.value = value;
            this.revision = revision;
        }
    }
}
