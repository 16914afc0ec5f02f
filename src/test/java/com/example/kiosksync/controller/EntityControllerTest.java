package com.example.kiosksync.controller;

import com.example.kiosksync.cache.CreatePolicy;
import com.example.kiosksync.cache.LocalCache;
import com.example.kiosksync.gateway.EmbeddedEntityGateway;
import com.example.kiosksync.model.Avatar;
import com.example.kiosksync.service.EntityStoreService;
import com.example.kiosksync.service.VersionManifestStore;
import com.example.kiosksync.support.InMemoryKvClient;
import com.example.kiosksync.support.InMemoryObjectStore;
import com.example.kiosksync.support.TestClock;
import com.example.kiosksync.support.TestMappers;
import com.example.kiosksync.sync.EntityKind;
import com.example.kiosksync.sync.EntityModule;
import com.example.kiosksync.sync.EntityRegistry;
import com.example.kiosksync.sync.SyncEngine;
import com.example.kiosksync.sync.VersionClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;
import java.util.Map;

class EntityControllerTest {

    private InMemoryObjectStore store;
    private EntityStoreService<Avatar> service;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore();
        ObjectMapper mapper = TestMappers.json();
        VersionClock versions = new VersionClock(new TestClock(Instant.parse("2025-01-01T00:00:00Z")));
        VersionManifestStore manifest = new VersionManifestStore(store, mapper, versions,
                EntityKind.AVATAR.manifestKey(), 5);
        service = new EntityStoreService<>(EntityKind.AVATAR, store, manifest, mapper, versions);
        EmbeddedEntityGateway<Avatar> gateway = new EmbeddedEntityGateway<>(service, mapper);
        LocalCache<Avatar> cache = new LocalCache<>(EntityKind.AVATAR, new InMemoryKvClient(), gateway, mapper,
                versions, CreatePolicy.LOCAL_FIRST);
        EntityRegistry registry = new EntityRegistry(List.<EntityModule<?>>of(
                new EntityModule<>(EntityKind.AVATAR, service, cache, new SyncEngine<>(cache, gateway))));

        client = WebTestClient.bindToController(new EntityController(registry, mapper))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testAdd_ThenGet() {
        // When
        client.post().uri("/api/avatar/add")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("id", "prof-smith", "name", "Prof Smith"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.id").isEqualTo("prof-smith")
                .jsonPath("$.version").isNumber();

        // Then
        client.get().uri("/api/avatar/get?id=prof-smith")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.entity.name").isEqualTo("Prof Smith")
                .jsonPath("$.entity.published").isEqualTo(false)
                .jsonPath("$.version").isNumber();
    }

    @Test
    void testAdd_DuplicateIsConflict() {
        service.create(Avatar.builder().id("prof-smith").name("Prof Smith").build());

        client.post().uri("/api/avatar/add")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("id", "prof-smith", "name", "Prof Smith"))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("duplicate")
                .jsonPath("$.id").isEqualTo("prof-smith");
    }

    @Test
    void testAdd_ReservedNameIsBadRequest() {
        client.post().uri("/api/avatar/add")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "New"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("reserved_id");
    }

    @Test
    void testEdit_StaleExpectedVersionIsConflict() {
        // Given
        long version = service.create(Avatar.builder().id("prof-smith").name("Prof Smith").build());

        // When / Then
        client.post().uri("/api/avatar/edit")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("id", "prof-smith", "entity", Map.of("title", "Dr"), "expectedVersion", version - 1))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("version_conflict")
                .jsonPath("$.currentVersion").isEqualTo(version);
    }

    @Test
    void testEdit_MissingEntityIsBadRequest() {
        client.post().uri("/api/avatar/edit")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("id", "prof-smith"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("invalid_request");
    }

    @Test
    void testSync_ReportsStaleAndConflicting() {
        // Given
        service.create(Avatar.builder().id("a").name("A").build());
        service.create(Avatar.builder().id("b").name("B").build());

        // When / Then
        client.post().uri("/api/avatar/sync")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("localVersions", Map.of("a", 1), "dirtyIds", List.of("a")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.needsUpdate.length()").isEqualTo(2)
                .jsonPath("$.conflicts[0]").isEqualTo("a")
                .jsonPath("$.serverVersions.b.version").isNumber();
    }

    @Test
    void testDelete_MissingIsNotFound() {
        client.post().uri("/api/avatar/delete")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("id", "ghost"))
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("not_found");
    }

    @Test
    void testUnknownType_IsNotFound() {
        client.get().uri("/api/spaceship/sync")
                .exchange()
                .expectStatus().isNotFound();
    }
}
