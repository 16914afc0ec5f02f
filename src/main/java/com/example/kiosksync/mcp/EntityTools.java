package com.example.kiosksync.mcp;

import com.example.kiosksync.model.SyncEntity;
import com.example.kiosksync.model.SyncReport;
import com.example.kiosksync.model.VersionedRecord;
import com.example.kiosksync.sync.EntityModule;
import com.example.kiosksync.sync.EntityRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Edge operations on the locally cached entities. {@code type} is {@code avatar} or
 * {@code cohort}.
 */
@Service
public class EntityTools {

    private final EntityRegistry registry;
    private final ObjectMapper mapper;

    public EntityTools(EntityRegistry registry, ObjectMapper mapper) {
        this.registry = registry;
        this.mapper = mapper;
    }

    @Tool(description = "Sync the local cache of an entity type with the backend and list the records")
    public Map<String,Object> entity_sync(String type) {
        SyncReport<?> report = registry.module(type).getEngine().list();
        return mapper.convertValue(report, Map.class);
    }

    @Tool(description = "Get a cached entity record with its version bookkeeping")
    public Map<String,Object> entity_get(String type, String id) {
        Map<String, Object> result = new HashMap<>();
        result.put("id", id);
        result.put("record", registry.module(type).getCache().get(id).orElse(null));
        return result;
    }

    @Tool(description = "Create an entity from its fields; the id is derived from the name")
    public Map<String,Object> entity_add(String type, Map<String,Object> fields) {
        return toMap(add(registry.module(type), fields));
    }

    @Tool(description = "Apply field changes to a cached entity locally, marking it dirty")
    public Map<String,Object> entity_update_local(String type, String id, Map<String,Object> changes) {
        return toMap(registry.module(type).getCache().updateLocal(id, changes));
    }

    @Tool(description = "Push a dirty cached entity to the backend")
    public Map<String,Object> entity_save(String type, String id) {
        return toMap(registry.module(type).getCache().save(id));
    }

    @Tool(description = "Delete an entity remotely, then from the local cache")
    public Map<String,Object> entity_delete(String type, String id) {
        registry.module(type).getCache().delete(id);
        return Map.of("ok", true, "id", id);
    }

    @Tool(description = "Discard local edits of an entity and reload the backend copy")
    public Map<String,Object> entity_revert(String type, String id) {
        Map<String, Object> result = new HashMap<>();
        result.put("id", id);
        result.put("record", registry.module(type).getCache().revertToRemote(id).orElse(null));
        return result;
    }

    @Tool(description = "Publish or unpublish an entity and save it")
    public Map<String,Object> entity_toggle_publish(String type, String id, Boolean published) {
        return toMap(registry.module(type).getCache().togglePublish(id, Boolean.TRUE.equals(published)));
    }

    @Tool(description = "Count total, dirty and synced records of an entity type")
    public Map<String,Object> entity_status(String type) {
        return mapper.convertValue(registry.module(type).getCache().status(), Map.class);
    }

    private <T extends SyncEntity> VersionedRecord<T> add(EntityModule<T> module, Map<String, Object> fields) {
        T draft = mapper.convertValue(fields, module.getKind().getType());
        return module.getCache().add(draft);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toMap(VersionedRecord<?> record) {
        return mapper.convertValue(record, Map.class);
    }
}
