package com.example.kiosksync.model;

import java.time.Instant;

/**
 * A domain record managed by the versioned cache/sync pattern. The id is a slug fixed at
 * creation time.
 */
public interface SyncEntity {

    String getId();
    void setId(String id);

    String getName();

    Boolean getPublished();

    String getCreatedBy();
    void setCreatedBy(String createdBy);

    Instant getCreatedAt();
    void setCreatedAt(Instant createdAt);

    String getLastEditedBy();
    void setLastEditedBy(String lastEditedBy);

    Instant getLastEditedAt();
    void setLastEditedAt(Instant lastEditedAt);
}
