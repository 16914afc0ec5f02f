package com.example.kiosksync.controller;

import com.example.kiosksync.kv.KvClient;
import com.example.kiosksync.store.ObjectStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final ObjectStore objectStore;

    public HealthController(KvClient kvClient, ObjectStore objectStore) {
        this.kvClient = kvClient;
        this.objectStore = objectStore;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "kiosk-sync");
        health.put("version", "1.0.0");

        // local cache (edge role)
        try {
            kvClient.get("health-check");
            health.put("redis", "UP");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        // object store (backend role)
        try {
            objectStore.exists("health-check");
            health.put("mongodb", "UP");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }
}
