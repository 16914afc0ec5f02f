package com.example.kiosksync.store;

/**
 * A conditional write found the object at a different revision than the caller read.
 */
public class RevisionConflictException extends RuntimeException {

    private final String key;
    private final long expectedRevision;

    public RevisionConflictException(String key, long expectedRevision) {
        super("Object " + key + " is no longer at revision " + expectedRevision);
        this.key = key;
        this.expectedRevision = expectedRevision;
    }

    public String getKey() { return key; }
    public long getExpectedRevision() { return expectedRevision; }
}
