package com.example.kiosksync.mcp;

import com.example.kiosksync.sync.EntityRegistry;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class CapabilitiesTools {

    private final EntityRegistry registry;

    public CapabilitiesTools(EntityRegistry registry) {
        this.registry = registry;
    }

    @Tool(description = "List server info and the entity types that can be synced")
    public Map<String,Object> capabilities_list() {
        return Map.of(
                "server", Map.of("name", "kiosk-sync", "version", "1.0.0"),
                "entityTypes", registry.types(),
                "capabilities", Map.of(
                    "tools", true,
                    "resources", false,
                    "prompts", false,
                    "completion", false
                )
        );
    }
}
