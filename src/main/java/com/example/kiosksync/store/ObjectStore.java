package com.example.kiosksync.store;

import com.example.kiosksync.model.StoredObject;

import java.util.List;
import java.util.Optional;

/**
 * Durable key &rarr; blob store backing the manifests, entity bodies, archived chats and the
 * chat index.
 */
public interface ObjectStore {

    String JSON = "application/json";
    String GZIP = "application/gzip";

    Optional<StoredObject> get(String key);

    /** Metadata probe; never transfers the body. */
    boolean exists(String key);

    /** Unconditional write, returns the new revision. */
    long put(String key, byte[] body, String contentType);

    /**
     * Writes only if the object is still at {@code expectedRevision}; {@code 0} means the
     * object must not exist yet. Returns the new revision.
     *
     * @throws RevisionConflictException when another writer got there first
     */
    long putIfRevision(String key, byte[] body, String contentType, long expectedRevision);

    /** Returns whether something was deleted. Deleting a missing key is not an error. */
    boolean delete(String key);

    List<String> list(String prefix);
}
