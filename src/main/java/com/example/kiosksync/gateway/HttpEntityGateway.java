package com.example.kiosksync.gateway;

import com.example.kiosksync.error.NotFoundException;
import com.example.kiosksync.model.ReconcileResult;
import com.example.kiosksync.model.RemoteEntity;
import com.example.kiosksync.model.SyncEntity;
import com.example.kiosksync.sync.EntityKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.*;

/**
 * Talks to a remote backend over {@code /api/{type}/*}.
 */
public class HttpEntityGateway<T extends SyncEntity> implements EntityGateway<T> {

    private final EntityKind<T> kind;
    private final WebClient web;
    private final ObjectMapper mapper;
    private final RemoteCalls remote;

    public HttpEntityGateway(EntityKind<T> kind, WebClient web, ObjectMapper mapper, Duration timeout) {
        this.kind = kind;
        this.web = web;
        this.mapper = mapper;
        this.remote = new RemoteCalls(kind.getName(), timeout);
    }

    @Override
    public long create(T entity) {
        String what = "add " + entity.getId();
        JsonNode body = remote.call(what, web.post()
                .uri("/api/{type}/add", kind.getName())
                .bodyValue(entity)
                .retrieve()
                .onStatus(s -> s.isError(), remote::toException)
                .bodyToMono(JsonNode.class));
        return remote.version(what, body);
    }

    @Override
    public long edit(String id, T entity, long expectedVersion) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("id", id);
        request.put("entity", entity);
        request.put("expectedVersion", expectedVersion);
        String what = "edit " + id;
        JsonNode body = remote.call(what, web.post()
                .uri("/api/{type}/edit", kind.getName())
                .bodyValue(request)
                .retrieve()
                .onStatus(s -> s.isError(), remote::toException)
                .bodyToMono(JsonNode.class));
        return remote.version(what, body);
    }

    @Override
    public Optional<RemoteEntity<T>> fetch(String id) {
        try {
            String what = "get " + id;
            JsonNode body = remote.require(what, remote.call(what, web.get()
                    .uri(b -> b.path("/api/{type}/get").queryParam("id", id).build(kind.getName()))
                    .retrieve()
                    .onStatus(s -> s.isError(), remote::toException)
                    .bodyToMono(JsonNode.class)));
            T entity = mapper.convertValue(body.path("entity"), kind.getType());
            return Optional.of(new RemoteEntity<>(entity, body.path("version").asLong()));
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    public void delete(String id) {
        remote.call("delete " + id, web.post()
                .uri("/api/{type}/delete", kind.getName())
                .bodyValue(Map.of("id", id))
                .retrieve()
                .onStatus(s -> s.isError(), remote::toException)
                .bodyToMono(JsonNode.class));
    }

    @Override
    public ReconcileResult reconcile(Map<String, Long> localVersions, Collection<String> dirtyIds) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("localVersions", localVersions);
        request.put("dirtyIds", dirtyIds == null ? List.of() : dirtyIds);
        return remote.require("sync", remote.call("sync", web.post()
                .uri("/api/{type}/sync", kind.getName())
                .bodyValue(request)
                .retrieve()
                .onStatus(s -> s.isError(), remote::toException)
                .bodyToMono(ReconcileResult.class)));
    }
}
