package com.example.kiosksync.controller;

import com.example.kiosksync.error.InvalidRequestException;
import com.example.kiosksync.error.NotFoundException;
import com.example.kiosksync.model.ReconcileResult;
import com.example.kiosksync.model.RemoteEntity;
import com.example.kiosksync.model.SyncEntity;
import com.example.kiosksync.model.VersionManifest;
import com.example.kiosksync.service.EntityStoreService;
import com.example.kiosksync.sync.EntityRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * Backend persistence API, one set of routes per entity type.
 */
@RestController
@RequestMapping("/api/{type}")
public class EntityController {

    private final EntityRegistry registry;
    private final ObjectMapper mapper;

    public EntityController(EntityRegistry registry, ObjectMapper mapper) {
        this.registry = registry;
        this.mapper = mapper;
    }

    @PostMapping("/sync")
    public ResponseEntity<ReconcileResult> sync(@PathVariable String type, @RequestBody JsonNode body) {
        Map<String, Long> localVersions = new LinkedHashMap<>();
        body.path("localVersions").fields().forEachRemaining(e -> localVersions.put(e.getKey(), e.getValue().asLong()));
        List<String> dirtyIds = new ArrayList<>();
        body.path("dirtyIds").forEach(n -> dirtyIds.add(n.asText()));
        return ResponseEntity.ok(store(type).reconcile(localVersions, dirtyIds));
    }

    @GetMapping("/sync")
    public ResponseEntity<VersionManifest> manifest(@PathVariable String type) {
        return ResponseEntity.ok(store(type).manifest());
    }

    @PostMapping("/add")
    public ResponseEntity<Map<String, Object>> add(@PathVariable String type, @RequestBody JsonNode body) {
        return ResponseEntity.ok(create(store(type), body));
    }

    @PostMapping("/edit")
    public ResponseEntity<Map<String, Object>> edit(@PathVariable String type, @RequestBody JsonNode body) {
        String id = requireText(body, "id");
        if (!body.path("entity").isObject()) {
            throw new InvalidRequestException("Missing required field: entity");
        }
        long version = edit(store(type), id, body.path("entity"), body.path("expectedVersion").asLong(0L));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("id", id);
        result.put("version", version);
        return ResponseEntity.ok(result);
    }

    @GetMapping("/get")
    public ResponseEntity<RemoteEntity<? extends SyncEntity>> get(@PathVariable String type, @RequestParam String id) {
        EntityStoreService<?> store = store(type);
        RemoteEntity<? extends SyncEntity> found = store.fetch(id)
                .orElseThrow(() -> new NotFoundException(store.kind().getName(), id));
        return ResponseEntity.ok(found);
    }

    @PostMapping("/delete")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String type, @RequestBody JsonNode body) {
        String id = requireText(body, "id");
        store(type).delete(id);
        return ResponseEntity.ok(Map.of("success", true, "id", id));
    }

    private EntityStoreService<?> store(String type) {
        return registry.module(type).getStore();
    }

    private <T extends SyncEntity> Map<String, Object> create(EntityStoreService<T> store, JsonNode body) {
        T entity = mapper.convertValue(body, store.kind().getType());
        long version = store.create(entity);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("id", entity.getId());
        result.put("version", version);
        return result;
    }

    private <T extends SyncEntity> long edit(EntityStoreService<T> store, String id, JsonNode entity, long expectedVersion) {
        return store.edit(id, mapper.convertValue(entity, store.kind().getType()), expectedVersion);
    }

    private static String requireText(JsonNode body, String field) {
        String value = body.path(field).asText("");
        if (value.isBlank()) {
            throw new InvalidRequestException("Missing required field: " + field);
        }
        return value;
    }
}
