package com.example.kiosksync.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/**
 * Local cache entry: the entity plus its version bookkeeping.
 * <p>
 * {@code dirty} is set whenever {@code localVersion} was advanced by a local mutation the
 * backend has not confirmed yet. {@code remoteVersion} only ever holds a value returned by
 * the backend, {@code 0} meaning the backend has never acknowledged the record.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class VersionedRecord<T extends SyncEntity> {
    private T entity;
    private long localVersion;
    private long remoteVersion;
    @JsonProperty("isDirty")
    private boolean dirty;

    public String id() {
        return entity.getId();
    }
}
