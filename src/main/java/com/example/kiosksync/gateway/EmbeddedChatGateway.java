package com.example.kiosksync.gateway;

import com.example.kiosksync.chat.ChatArchiver;
import com.example.kiosksync.error.RemoteUnavailableException;
import com.example.kiosksync.error.SyncException;
import com.example.kiosksync.model.ChatSaveRequest;
import com.example.kiosksync.model.ChatSession;
import com.example.kiosksync.model.ChatSessionMetadata;
import com.example.kiosksync.model.SessionFilter;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

public class EmbeddedChatGateway implements ChatGateway {

    private final ChatArchiver archiver;

    public EmbeddedChatGateway(ChatArchiver archiver) {
        this.archiver = archiver;
    }

    @Override
    public void save(ChatSaveRequest request) {
        call("save " + request.getSessionId(), () -> archiver.accept(request));
    }

    @Override
    public Optional<ChatSession> get(String sessionId) {
        return call("get " + sessionId, () -> archiver.get(sessionId));
    }

    @Override
    public List<ChatSessionMetadata> list(SessionFilter filter) {
        return call("list", () -> archiver.list(filter));
    }

    @Override
    public void delete(String sessionId) {
        call("delete " + sessionId, () -> {
            archiver.delete(sessionId);
            return null;
        });
    }

    private <R> R call(String what, Supplier<R> action) {
        try {
            return action.get();
        } catch (SyncException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RemoteUnavailableException("chat " + what + " failed: " + e.getMessage(), e);
        }
    }
}
