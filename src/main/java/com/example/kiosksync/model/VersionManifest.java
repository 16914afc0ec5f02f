package com.example.kiosksync.model;

import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Authoritative id &rarr; version map for one entity type, held in the backing store.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VersionManifest {
    private long overallVersion;
    private Map<String, ManifestEntry> entries = new LinkedHashMap<>();

    public static VersionManifest empty(long overallVersion) {
        return new VersionManifest(overallVersion, new LinkedHashMap<>());
    }

    public long versionOf(String id) {
        ManifestEntry entry = entries.get(id);
        return entry == null ? 0L : entry.getVersion();
    }
}
