package com.example.kiosksync.chat;

import com.example.kiosksync.model.ChatSessionMetadata;
import com.example.kiosksync.store.JsonDocument;
import com.example.kiosksync.store.ObjectStore;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * The session index at {@code chats/index.json}: metadata of every archived session, newest
 * start time first. Rewritten in full on every change, conditionally on its revision.
 */
public class SessionIndexStore {

    public static final String KEY = "chats/index.json";

    private static final Comparator<ChatSessionMetadata> NEWEST_FIRST =
            Comparator.comparingLong(ChatSessionMetadata::getStartTime).reversed();

    private final JsonDocument<List<ChatSessionMetadata>> document;

    public SessionIndexStore(ObjectStore store, ObjectMapper mapper, int maxAttempts) {
        this.document = new JsonDocument<>(store, mapper, KEY,
                mapper.getTypeFactory().constructCollectionType(List.class, ChatSessionMetadata.class),
                ArrayList::new,
                maxAttempts);
    }

    public List<ChatSessionMetadata> read() {
        return document.read();
    }

    /** Replaces the entry of the same session id, or adds it. */
    public void upsert(ChatSessionMetadata metadata) {
        document.update(index -> {
            List<ChatSessionMetadata> next = without(index, metadata.getSessionId());
            next.add(metadata);
            next.sort(NEWEST_FIRST);
            return next;
        });
    }

    public void remove(String sessionId) {
        document.update(index -> without(index, sessionId));
    }

    public void replaceAll(Collection<ChatSessionMetadata> entries) {
        document.update(index -> {
            List<ChatSessionMetadata> next = new ArrayList<>(entries);
            next.sort(NEWEST_FIRST);
            return next;
        });
    }

    private static List<ChatSessionMetadata> without(List<ChatSessionMetadata> index, String sessionId) {
        List<ChatSessionMetadata> next = new ArrayList<>(index.size() + 1);
        for (ChatSessionMetadata m : index) {
            if (!sessionId.equals(m.getSessionId())) next.add(m);
        }
        return next;
    }
}
