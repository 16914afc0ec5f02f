package com.example.kiosksync.mcp;

import com.example.kiosksync.service.CacheStatusService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class StatusTools {

    private final CacheStatusService statusService;

    public StatusTools(CacheStatusService statusService) {
        this.statusService = statusService;
    }

    @Tool(description = "Report unsaved entity edits, parked and recoverable chat sessions of this node")
    public Map<String, Object> sync_status_report() {
        return statusService.report();
    }
}
