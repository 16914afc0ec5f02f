package com.example.kiosksync.model;

import lombok.*;

/**
 * An entity as served by the backend together with the manifest version it was read at.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemoteEntity<T extends SyncEntity> {
    private T entity;
    private long version;
}
