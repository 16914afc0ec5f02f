package com.example.kiosksync.gateway;

import com.example.kiosksync.model.ChatSaveRequest;
import com.example.kiosksync.model.ChatSession;
import com.example.kiosksync.model.ChatSessionMetadata;
import com.example.kiosksync.model.SessionFilter;

import java.util.List;
import java.util.Optional;

/**
 * Edge access to the chat archive.
 */
public interface ChatGateway {

    /**
     * @throws com.example.kiosksync.error.DuplicateEntityException when the session is archived already
     */
    void save(ChatSaveRequest request);

    Optional<ChatSession> get(String sessionId);

    List<ChatSessionMetadata> list(SessionFilter filter);

    void delete(String sessionId);
}
