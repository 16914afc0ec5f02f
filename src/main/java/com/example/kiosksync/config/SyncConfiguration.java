package com.example.kiosksync.config;

import com.example.kiosksync.cache.CreatePolicy;
import com.example.kiosksync.cache.LocalCache;
import com.example.kiosksync.chat.ChatArchiver;
import com.example.kiosksync.chat.GzipCodec;
import com.example.kiosksync.chat.SessionIndexStore;
import com.example.kiosksync.chat.SessionLifecycleManager;
import com.example.kiosksync.gateway.*;
import com.example.kiosksync.kv.KvClient;
import com.example.kiosksync.model.Avatar;
import com.example.kiosksync.model.Cohort;
import com.example.kiosksync.model.SyncEntity;
import com.example.kiosksync.service.EntityStoreService;
import com.example.kiosksync.service.VersionManifestStore;
import com.example.kiosksync.store.ObjectStore;
import com.example.kiosksync.sync.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires both roles. With {@code app.remote.base-url} blank the edge components call the
 * backend components of this process directly; otherwise they go over HTTP.
 */
@Configuration
public class SyncConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(SyncConfiguration.class);

    @Value("${app.remote.base-url:}")
    private String remoteBaseUrl;

    @Value("${app.remote.timeout-ms:5000}")
    private long remoteTimeoutMs;

    @Value("${app.sync.create-policy:LOCAL_FIRST}")
    private CreatePolicy createPolicy;

    @Value("${app.store.cas-max-attempts:5}")
    private int casMaxAttempts;

    @Value("${app.chat.compression-enabled:true}")
    private boolean compressionEnabled;

    @Value("${app.chat.kiosk-max-messages:100}")
    private int kioskMaxMessages;

    @Value("${app.chat.recovery-ttl-hours:72}")
    private long recoveryTtlHours;

    @Value("${app.chat.flush-timeout-ms:3000}")
    private long flushTimeoutMs;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public VersionClock versionClock(Clock clock) {
        return new VersionClock(clock);
    }

    @Bean
    public WebClient backendWebClient(WebClient.Builder builder) {
        return isRemote() ? builder.baseUrl(remoteBaseUrl).build() : builder.build();
    }

    @Bean
    public EntityModule<Avatar> avatarModule(ObjectStore store, KvClient kv, ObjectMapper mapper,
                                             VersionClock versions, WebClient backendWebClient) {
        return module(EntityKind.AVATAR, store, kv, mapper, versions, backendWebClient);
    }

    @Bean
    public EntityModule<Cohort> cohortModule(ObjectStore store, KvClient kv, ObjectMapper mapper,
                                             VersionClock versions, WebClient backendWebClient) {
        return module(EntityKind.COHORT, store, kv, mapper, versions, backendWebClient);
    }

    @Bean
    public EntityRegistry entityRegistry(List<EntityModule<?>> modules) {
        return new EntityRegistry(modules);
    }

    @Bean
    public ChatArchiver chatArchiver(ObjectStore store, ObjectMapper mapper, VersionClock versions) {
        return new ChatArchiver(store, mapper, new SessionIndexStore(store, mapper, casMaxAttempts),
                new GzipCodec(), versions, compressionEnabled, kioskMaxMessages);
    }

    @Bean
    public ChatGateway chatGateway(ChatArchiver archiver, WebClient backendWebClient) {
        if (isRemote()) {
            return new HttpChatGateway(backendWebClient, Duration.ofMillis(remoteTimeoutMs));
        }
        return new EmbeddedChatGateway(archiver);
    }

    @Bean
    public SessionLifecycleManager sessionLifecycleManager(ChatGateway chatGateway, KvClient kv, ObjectMapper mapper,
                                                           VersionClock versions) {
        return new SessionLifecycleManager(chatGateway, kv, mapper, versions,
                Duration.ofHours(recoveryTtlHours), Duration.ofMillis(flushTimeoutMs));
    }

    private <T extends SyncEntity> EntityModule<T> module(EntityKind<T> kind, ObjectStore store, KvClient kv,
                                                           ObjectMapper mapper, VersionClock versions, WebClient web) {
        VersionManifestStore manifest = new VersionManifestStore(store, mapper, versions, kind.manifestKey(), casMaxAttempts);
        EntityStoreService<T> service = new EntityStoreService<>(kind, store, manifest, mapper, versions);

        EntityGateway<T> gateway;
        if (isRemote()) {
            gateway = new HttpEntityGateway<>(kind, web, mapper, Duration.ofMillis(remoteTimeoutMs));
            logger.info("{} gateway: HTTP {}", kind, remoteBaseUrl);
        } else {
            gateway = new EmbeddedEntityGateway<>(service, mapper);
            logger.info("{} gateway: embedded", kind);
        }

        LocalCache<T> cache = new LocalCache<>(kind, kv, gateway, mapper, versions, createPolicy);
        return new EntityModule<>(kind, service, cache, new SyncEngine<>(cache, gateway));
    }

    private boolean isRemote() {
        return remoteBaseUrl != null && !remoteBaseUrl.isBlank();
    }
}
