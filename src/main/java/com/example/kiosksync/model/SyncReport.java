package com.example.kiosksync.model;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one {@code SyncEngine.list()} pass.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncReport<T extends SyncEntity> {
    @Builder.Default
    private List<VersionedRecord<T>> records = new ArrayList<>();
    @Builder.Default
    private List<String> pulled = new ArrayList<>();
    @Builder.Default
    private List<String> removed = new ArrayList<>();
    @Builder.Default
    private List<String> conflicts = new ArrayList<>();
    // true when the backend could not be reached and records is the cached view
    private boolean offline;

    public static <T extends SyncEntity> SyncReport<T> offline(List<VersionedRecord<T>> records) {
        return SyncReport.<T>builder().records(records).offline(true).build();
    }
}
