package com.example.kiosksync.service;

import com.example.kiosksync.error.VersionConflictException;
import com.example.kiosksync.model.ManifestEntry;
import com.example.kiosksync.model.VersionManifest;
import com.example.kiosksync.store.ObjectStore;
import com.example.kiosksync.support.InMemoryObjectStore;
import com.example.kiosksync.support.TestClock;
import com.example.kiosksync.support.TestMappers;
import com.example.kiosksync.sync.VersionClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class VersionManifestStoreTest {

    private static final String KEY = "avatars/version.json";

    private InMemoryObjectStore store;
    private VersionManifestStore manifest;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore();
        VersionClock versions = new VersionClock(new TestClock(Instant.ofEpochMilli(10_000L)));
        manifest = new VersionManifestStore(store, TestMappers.json(), versions, KEY, 5);
    }

    @Test
    void testRead_CreatesManifestLazily() {
        // When
        VersionManifest read = manifest.read();

        // Then
        assertTrue(read.getEntries().isEmpty());
        assertTrue(store.exists(KEY));
    }

    @Test
    void testRecordWrite_BumpsOverallAndEntry() {
        long first = manifest.recordWrite("a", true, 0L);
        long second = manifest.recordWrite("b", false, 0L);

        VersionManifest read = manifest.read();
        assertTrue(second > first);
        assertEquals(second, read.getOverallVersion());
        assertEquals(first, read.versionOf("a"));
        assertTrue(read.getEntries().get("a").isPublished());
        assertFalse(read.getEntries().get("b").isPublished());
    }

    @Test
    void testRecordWrite_StaleExpectedVersionConflicts() {
        // Given
        long v1 = manifest.recordWrite("a", false, 0L);
        long v2 = manifest.recordWrite("a", false, v1);

        // When
        VersionConflictException e = assertThrows(VersionConflictException.class,
                () -> manifest.recordWrite("a", false, v1));

        // Then
        assertEquals(v2, e.getCurrentVersion());
        assertEquals(v1, e.getExpectedVersion());
        assertEquals(v2, manifest.versionOf("a"));
    }

    @Test
    void testRecordWrite_ZeroExpectedVersionSkipsCheck() {
        manifest.recordWrite("a", false, 0L);
        manifest.recordWrite("a", false, 0L);

        assertTrue(manifest.versionOf("a") > 0);
    }

    @Test
    void testRecordWrite_ConcurrentWriterEntryKept() {
        // Given
        manifest.read();
        AtomicBoolean injected = new AtomicBoolean();
        store.beforeConditionalWrite(key -> {
            if (injected.compareAndSet(false, true)) {
                // another backend records "other" between our read and write
                String json = "{\"overallVersion\":20000,\"entries\":{\"other\":{\"version\":20000,\"published\":false}}}";
                store.put(KEY, json.getBytes(), ObjectStore.JSON);
            }
        });

        // When
        long version = manifest.recordWrite("mine", false, 0L);

        // Then
        VersionManifest read = manifest.read();
        assertEquals(20_000L, read.versionOf("other"));
        assertEquals(version, read.versionOf("mine"));
        assertEquals(20_001L, version);
    }

    @Test
    void testRevertWrite_RestoresPreviousEntryUnlessReplaced() {
        // Given
        long v1 = manifest.recordWrite("a", true, 0L);
        long failed = manifest.recordWrite("a", false, v1);
        long orphan = manifest.recordWrite("b", false, 0L);
        long replaced = manifest.recordWrite("b", true, 0L);

        // When
        manifest.revertWrite("a", failed, new ManifestEntry(v1, true));
        manifest.revertWrite("b", orphan, null);
        manifest.revertWrite("c", 42L, null);

        // Then
        VersionManifest read = manifest.read();
        assertEquals(v1, read.versionOf("a"));
        assertTrue(read.getEntries().get("a").isPublished());
        assertEquals(replaced, read.versionOf("b"));
        assertFalse(read.getEntries().containsKey("c"));
    }

    @Test
    void testRemove_DropsEntry() {
        manifest.recordWrite("a", false, 0L);
        long before = manifest.read().getOverallVersion();

        manifest.remove("a");

        VersionManifest read = manifest.read();
        assertFalse(read.getEntries().containsKey("a"));
        assertTrue(read.getOverallVersion() > before);
    }
}
