package com.example.kiosksync.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final EntityTools entityTools;
    private final ChatTools chatTools;
    private final StatusTools statusTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(EntityTools entityTools, ChatTools chatTools, StatusTools statusTools,
                                  CapabilitiesTools capTools) {
        this.entityTools = entityTools;
        this.chatTools = chatTools;
        this.statusTools = statusTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(entityTools, chatTools, statusTools, capTools)
                .build();
    }
}
