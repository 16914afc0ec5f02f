package com.example.kiosksync.controller;

import com.example.kiosksync.kv.KvClient;
import com.example.kiosksync.store.ObjectStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private KvClient kvClient;

    @Mock
    private ObjectStore objectStore;

    @InjectMocks
    private HealthController healthController;

    @Test
    void testHealth_AllUp() {
        // Given
        when(kvClient.get("health-check")).thenReturn(Optional.empty());
        when(objectStore.exists("health-check")).thenReturn(false);

        // When
        Map<String, Object> health = healthController.health().getBody();

        // Then
        assertEquals("UP", health.get("redis"));
        assertEquals("UP", health.get("mongodb"));
    }

    @Test
    void testHealth_StoreDownReported() {
        // Given
        when(kvClient.get("health-check")).thenReturn(Optional.empty());
        when(objectStore.exists("health-check")).thenThrow(new IllegalStateException("connection refused"));

        // When
        Map<String, Object> health = healthController.health().getBody();

        // Then
        assertEquals("UP", health.get("status"));
        assertEquals("DOWN", health.get("mongodb"));
        assertEquals("connection refused", health.get("mongodbError"));
    }
}
