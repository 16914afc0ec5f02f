package com.example.kiosksync.gateway;

import com.example.kiosksync.error.NotFoundException;
import com.example.kiosksync.model.ChatSaveRequest;
import com.example.kiosksync.model.ChatSession;
import com.example.kiosksync.model.ChatSessionMetadata;
import com.example.kiosksync.model.SessionFilter;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Talks to a remote backend over {@code /api/chat/*}.
 */
public class HttpChatGateway implements ChatGateway {

    private static final ParameterizedTypeReference<List<ChatSessionMetadata>> METADATA_LIST =
            new ParameterizedTypeReference<>() {};

    private final WebClient web;
    private final RemoteCalls remote;

    public HttpChatGateway(WebClient web, Duration timeout) {
        this.web = web;
        this.remote = new RemoteCalls("chat session", timeout);
    }

    @Override
    public void save(ChatSaveRequest request) {
        remote.call("save " + request.getSessionId(), web.post()
                .uri("/api/chat/save")
                .bodyValue(request)
                .retrieve()
                .onStatus(s -> s.isError(), remote::toException)
                .bodyToMono(JsonNode.class));
    }

    @Override
    public Optional<ChatSession> get(String sessionId) {
        try {
            return Optional.ofNullable(remote.call("get " + sessionId, web.get()
                    .uri(b -> b.path("/api/chat/get").queryParam("sessionId", sessionId).build())
                    .retrieve()
                    .onStatus(s -> s.isError(), remote::toException)
                    .bodyToMono(ChatSession.class)));
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    public List<ChatSessionMetadata> list(SessionFilter filter) {
        SessionFilter f = filter == null ? SessionFilter.all() : filter;
        List<ChatSessionMetadata> result = remote.call("list", web.get()
                .uri(b -> {
                    b.path("/api/chat/list");
                    if (f.getAvatarId() != null) b.queryParam("avatarId", f.getAvatarId());
                    if (f.getUserId() != null) b.queryParam("userId", f.getUserId());
                    if (f.getStartDate() != null) b.queryParam("startDate", f.getStartDate().toString());
                    if (f.getEndDate() != null) b.queryParam("endDate", f.getEndDate().toString());
                    if (f.getLimit() != null) b.queryParam("limit", f.getLimit());
                    return b.build();
                })
                .retrieve()
                .onStatus(s -> s.isError(), remote::toException)
                .bodyToMono(METADATA_LIST));
        return result == null ? List.of() : result;
    }

    @Override
    public void delete(String sessionId) {
        remote.call("delete " + sessionId, web.post()
                .uri("/api/chat/delete")
                .bodyValue(Map.of("sessionId", sessionId))
                .retrieve()
                .onStatus(s -> s.isError(), remote::toException)
                .bodyToMono(JsonNode.class));
    }
}
