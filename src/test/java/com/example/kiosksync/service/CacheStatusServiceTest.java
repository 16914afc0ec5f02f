package com.example.kiosksync.service;

import com.example.kiosksync.cache.LocalCache;
import com.example.kiosksync.chat.SessionLifecycleManager;
import com.example.kiosksync.model.ActiveChatSession;
import com.example.kiosksync.model.Avatar;
import com.example.kiosksync.model.CacheStatus;
import com.example.kiosksync.sync.EntityKind;
import com.example.kiosksync.sync.EntityModule;
import com.example.kiosksync.sync.EntityRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CacheStatusServiceTest {

    @Mock
    private LocalCache<Avatar> avatarCache;

    @Mock
    private SessionLifecycleManager sessions;

    private CacheStatusService statusService;

    @BeforeEach
    void setUp() {
        EntityRegistry registry = new EntityRegistry(List.<EntityModule<?>>of(
                new EntityModule<>(EntityKind.AVATAR, null, avatarCache, null)));
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        statusService = new CacheStatusService(registry, sessions, clock);
    }

    @Test
    void testReport_InSync() {
        // Given
        when(avatarCache.status()).thenReturn(new CacheStatus(3, 0, 3));

        // When
        Map<String, Object> report = statusService.report();

        // Then
        assertEquals(CacheStatusService.IN_SYNC, report.get("overallSyncHealth"));
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), report.get("timestamp"));
        @SuppressWarnings("unchecked")
        Map<String, Object> entities = (Map<String, Object>) report.get("entities");
        assertEquals(new CacheStatus(3, 0, 3), entities.get("avatar"));
    }

    @Test
    void testReport_DirtyRecordsArePending() {
        // Given
        when(avatarCache.status()).thenReturn(new CacheStatus(3, 1, 2));
        when(sessions.active()).thenReturn(Optional.of(ActiveChatSession.builder().sessionId("s1").build()));

        // When
        Map<String, Object> report = statusService.report();

        // Then
        assertEquals(CacheStatusService.PENDING_CHANGES, report.get("overallSyncHealth"));
        @SuppressWarnings("unchecked")
        Map<String, Object> chat = (Map<String, Object>) report.get("chat");
        assertEquals("s1", chat.get("activeSessionId"));
    }

    @Test
    void testReport_ParkedSessionNeedsAttention() {
        // Given
        when(avatarCache.status()).thenReturn(new CacheStatus(0, 0, 0));
        when(sessions.parkedSessionIds()).thenReturn(List.of("s9"));

        // When
        Map<String, Object> report = statusService.report();

        // Then
        assertEquals(CacheStatusService.NEEDS_ATTENTION, report.get("overallSyncHealth"));
    }

    @Test
    void testPeriodicCheck_SwallowsFailures() {
        // Given
        when(avatarCache.status()).thenThrow(new IllegalStateException("redis down"));

        // When / Then
        assertDoesNotThrow(() -> statusService.periodicCheck());
        verify(sessions, never()).parkedSessionIds();
    }
}
