package com.example.kiosksync.service;

import com.example.kiosksync.error.VersionConflictException;
import com.example.kiosksync.model.ManifestEntry;
import com.example.kiosksync.model.VersionManifest;
import com.example.kiosksync.store.JsonDocument;
import com.example.kiosksync.store.ObjectStore;
import com.example.kiosksync.sync.VersionClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * The authoritative id &rarr; {version, published} map of one entity type.
 * <p>
 * Versions are issued here and nowhere else. Every write replaces the entry of its id and bumps
 * {@code overallVersion}; every delete drops the entry. Updates are conditional on the manifest
 * revision, so concurrent writers cannot drop each other's entries.
 */
public class VersionManifestStore {

    private static final Logger logger = LoggerFactory.getLogger(VersionManifestStore.class);

    private final JsonDocument<VersionManifest> document;
    private final VersionClock versions;

    public VersionManifestStore(ObjectStore store, ObjectMapper mapper, VersionClock versions,
                                String key, int maxAttempts) {
        this.versions = versions;
        this.document = new JsonDocument<>(store, mapper, key,
                mapper.constructType(VersionManifest.class),
                () -> VersionManifest.empty(versions.millis()),
                maxAttempts);
    }

    /** Reads the manifest, creating an empty one on first access. */
    public VersionManifest read() {
        return document.readOrCreate();
    }

    public long versionOf(String id) {
        return read().versionOf(id);
    }

    /**
     * Issues a new version for {@code id}.
     *
     * @param expectedVersion version the writer based its change on; {@code 0} skips the check
     * @throws VersionConflictException when the manifest already holds a newer version
     */
    public long recordWrite(String id, boolean published, long expectedVersion) {
        AtomicLong issued = new AtomicLong();
        document.update(manifest -> {
            long current = manifest.versionOf(id);
            if (expectedVersion > 0 && current > expectedVersion) {
                throw new VersionConflictException(id, current, expectedVersion);
            }
            long version = versions.next(manifest.getOverallVersion());
            manifest.setOverallVersion(version);
            manifest.getEntries().put(id, new ManifestEntry(version, published));
            issued.set(version);
            return manifest;
        });
        logger.debug("Manifest {}: {} -> v{}", document.key(), id, issued.get());
        return issued.get();
    }

    /**
     * Undoes a {@link #recordWrite} whose body never reached the store: the entry goes back to
     * {@code previous}, or is dropped when there was none. Left alone once a later write has
     * replaced {@code issuedVersion}. {@code overallVersion} is not rolled back.
     */
    public void revertWrite(String id, long issuedVersion, ManifestEntry previous) {
        document.update(manifest -> {
            if (manifest.versionOf(id) != issuedVersion) {
                return manifest;
            }
            if (previous == null) {
                manifest.getEntries().remove(id);
            } else {
                manifest.getEntries().put(id, previous);
            }
            return manifest;
        });
        logger.warn("Manifest {}: reverted {} v{} to {}", document.key(), id, issuedVersion,
                previous == null ? "absent" : "v" + previous.getVersion());
    }

    public void remove(String id) {
        document.update(manifest -> {
            manifest.getEntries().remove(id);
            manifest.setOverallVersion(versions.next(manifest.getOverallVersion()));
            return manifest;
        });
        logger.debug("Manifest {}: removed {}", document.key(), id);
    }
}
