package com.example.kiosksync.service;

import com.example.kiosksync.chat.SessionLifecycleManager;
import com.example.kiosksync.model.CacheStatus;
import com.example.kiosksync.sync.EntityModule;
import com.example.kiosksync.sync.EntityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Reports what this edge node still owes the backend: dirty records per entity type, parked
 * chat sessions and sessions left in the recovery cache.
 */
@Service
public class CacheStatusService {

    private static final Logger logger = LoggerFactory.getLogger(CacheStatusService.class);

    public static final String IN_SYNC = "IN_SYNC";
    public static final String PENDING_CHANGES = "PENDING_CHANGES";
    public static final String NEEDS_ATTENTION = "NEEDS_ATTENTION";

    private final EntityRegistry registry;
    private final SessionLifecycleManager sessions;
    private final Clock clock;

    public CacheStatusService(EntityRegistry registry, SessionLifecycleManager sessions, Clock clock) {
        this.registry = registry;
        this.sessions = sessions;
        this.clock = clock;
    }

    public Map<String, Object> report() {
        Map<String, Object> report = new LinkedHashMap<>();

        int dirty = 0;
        Map<String, Object> entities = new LinkedHashMap<>();
        for (EntityModule<?> module : registry.all()) {
            CacheStatus status = module.getCache().status();
            dirty += status.getDirty();
            entities.put(module.getKind().getName(), status);
        }
        report.put("entities", entities);

        List<String> parked = sessions.parkedSessionIds();
        List<String> recoverable = sessions.recoverableSessionIds();
        Map<String, Object> chat = new LinkedHashMap<>();
        chat.put("activeSessionId", sessions.active().map(s -> s.getSessionId()).orElse(null));
        chat.put("parkedSessions", parked);
        chat.put("recoverableSessions", recoverable);
        chat.put("cachedSessions", sessions.listCachedSessions(null, null, null).size());
        report.put("chat", chat);

        String health = !parked.isEmpty() ? NEEDS_ATTENTION : (dirty > 0 ? PENDING_CHANGES : IN_SYNC);
        report.put("overallSyncHealth", health);
        report.put("timestamp", Instant.now(clock));
        return report;
    }

    @Scheduled(fixedDelayString = "${app.status.check-interval-ms:300000}", initialDelay = 60000L)
    public void periodicCheck() {
        try {
            Map<String, Object> report = report();
            Object health = report.get("overallSyncHealth");
            if (IN_SYNC.equals(health)) {
                logger.debug("Edge cache in sync");
            } else {
                logger.warn("Edge cache status {}: {}", health, report);
            }
        } catch (RuntimeException e) {
            logger.warn("Status check failed: {}", e.getMessage());
        }
    }
}
