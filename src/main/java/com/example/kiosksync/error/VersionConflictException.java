package com.example.kiosksync.error;

/**
 * An edit was based on a version older than the one the manifest currently holds.
 */
public class VersionConflictException extends SyncException {

    private final String id;
    private final long currentVersion;
    private final long expectedVersion;

    public VersionConflictException(String id, long currentVersion, long expectedVersion) {
        super("Version conflict on '" + id + "': current " + currentVersion + ", expected " + expectedVersion);
        this.id = id;
        this.currentVersion = currentVersion;
        this.expectedVersion = expectedVersion;
    }

    public String getId() { return id; }
    public long getCurrentVersion() { return currentVersion; }
    public long getExpectedVersion() { return expectedVersion; }
}
