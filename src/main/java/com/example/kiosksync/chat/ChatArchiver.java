package com.example.kiosksync.chat;

import com.example.kiosksync.error.DuplicateEntityException;
import com.example.kiosksync.error.InvalidRequestException;
import com.example.kiosksync.error.NotFoundException;
import com.example.kiosksync.model.*;
import com.example.kiosksync.store.ObjectStore;
import com.example.kiosksync.store.RevisionConflictException;
import com.example.kiosksync.sync.VersionClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Durable storage of finished chat sessions under {@code chats/}, one object per session,
 * plus the {@link SessionIndexStore} used for listing.
 */
public class ChatArchiver {

    private static final Logger logger = LoggerFactory.getLogger(ChatArchiver.class);

    public static final String PREFIX = "chats/";
    private static final String JSON_SUFFIX = ".json";
    private static final String GZIP_SUFFIX = ".json.gz";

    private static final Pattern SESSION_ID = Pattern.compile("^[A-Za-z0-9_]+$");
    private static final int MAX_SESSION_ID_LENGTH = 50;
    private static final int MAX_CONTENT_LENGTH = 10_000;
    private static final String DEFAULT_KIOSK_LOCATION = "kiosk";

    private final ObjectStore store;
    private final ObjectMapper mapper;
    private final SessionIndexStore index;
    private final GzipCodec codec;
    private final VersionClock clock;
    private final boolean compressionEnabled;
    private final int kioskMaxMessages;

    public ChatArchiver(ObjectStore store, ObjectMapper mapper, SessionIndexStore index, GzipCodec codec,
                        VersionClock clock, boolean compressionEnabled, int kioskMaxMessages) {
        this.store = store;
        this.mapper = mapper;
        this.index = index;
        this.codec = codec;
        this.clock = clock;
        this.compressionEnabled = compressionEnabled;
        this.kioskMaxMessages = kioskMaxMessages;
    }

    /**
     * Validates a flattened save request and archives it.
     *
     * @throws InvalidRequestException on a malformed request
     * @throws DuplicateEntityException when the session id is archived already
     */
    public ChatSession accept(ChatSaveRequest request) {
        validate(request);
        if (exists(request.getSessionId())) {
            throw new DuplicateEntityException("chat session", request.getSessionId());
        }
        ChatSession session = ChatSession.of(request.toSession(), clock.now());
        save(session);
        return session;
    }

    /**
     * Public kiosk variant of {@link #accept}: kiosk mode only, bounded message count, no user
     * identity accepted.
     */
    public ChatSession acceptKiosk(ChatSaveRequest request) {
        if (!request.isKioskMode()) {
            throw new InvalidRequestException("This endpoint is only for kiosk mode sessions");
        }
        if (request.getMessages() != null && request.getMessages().size() > kioskMaxMessages) {
            throw new InvalidRequestException("Too many messages (limit: " + kioskMaxMessages + ")");
        }
        request.setUserId(null);
        request.setUserName(null);
        if (request.getLocation() == null || request.getLocation().isBlank()) {
            request.setLocation(DEFAULT_KIOSK_LOCATION);
        }
        return accept(request);
    }

    public void save(ChatSession session) {
        String sessionId = session.getMetadata().getSessionId();
        byte[] json = encode(session);
        String key;
        if (compressionEnabled) {
            key = PREFIX + sessionId + GZIP_SUFFIX;
            store.put(key, codec.compress(json, sessionId), ObjectStore.GZIP);
        } else {
            key = PREFIX + sessionId + JSON_SUFFIX;
            store.put(key, json, ObjectStore.JSON);
        }
        index.upsert(session.getMetadata());
        logger.info("Archived chat session {} ({} messages) at {}", sessionId,
                session.getMetadata().getMessageCount(), key);
    }

    /**
     * Looks up the compressed variant first, then the plain one written before compression
     * was switched on.
     */
    public Optional<ChatSession> get(String sessionId) {
        for (String key : keyVariants(sessionId)) {
            Optional<StoredObject> obj = store.get(key);
            if (obj.isEmpty() || obj.get().getBody() == null) continue;
            byte[] body = key.endsWith(GZIP_SUFFIX)
                    ? codec.decompress(obj.get().getBody(), sessionId)
                    : obj.get().getBody();
            return Optional.of(decode(body, key));
        }
        return Optional.empty();
    }

    public boolean exists(String sessionId) {
        return keyVariants(sessionId).stream().anyMatch(store::exists);
    }

    public void delete(String sessionId) {
        if (!exists(sessionId)) {
            throw new NotFoundException("chat session", sessionId);
        }
        for (String key : keyVariants(sessionId)) {
            store.delete(key);
        }
        index.remove(sessionId);
        logger.info("Deleted chat session {}", sessionId);
    }

    public List<ChatSessionMetadata> list(SessionFilter filter) {
        SessionFilter f = filter == null ? SessionFilter.all() : filter;
        List<ChatSessionMetadata> matching = index.read().stream()
                .filter(f::matches)
                .collect(Collectors.toList());
        if (f.getLimit() != null && f.getLimit() >= 0 && matching.size() > f.getLimit()) {
            return new ArrayList<>(matching.subList(0, f.getLimit()));
        }
        return matching;
    }

    /**
     * Rebuilds the index from the archived bodies under {@code chats/}. Unreadable bodies are
     * logged and left out.
     *
     * @return number of indexed sessions
     */
    public int rebuildIndex() {
        Map<String, ChatSessionMetadata> entries = new LinkedHashMap<>();
        for (String key : store.list(PREFIX)) {
            String sessionId = sessionIdOf(key);
            if (sessionId == null || entries.containsKey(sessionId)) continue;
            try {
                get(sessionId).ifPresent(s -> entries.put(sessionId, s.getMetadata()));
            } catch (RuntimeException e) {
                logger.warn("Skipping unreadable chat session {}: {}", key, e.getMessage());
            }
        }
        try {
            index.replaceAll(entries.values());
        } catch (RevisionConflictException e) {
            logger.error("Index rebuild lost the race against concurrent archivers", e);
            throw e;
        }
        logger.info("Rebuilt chat index with {} sessions", entries.size());
        return entries.size();
    }

    private void validate(ChatSaveRequest request) {
        if (isBlank(request.getSessionId()) || isBlank(request.getAvatarId())
                || isBlank(request.getAvatarName()) || request.getMessages() == null) {
            throw new InvalidRequestException("Missing required fields: sessionId, avatarId, avatarName, messages");
        }
        if (!SESSION_ID.matcher(request.getSessionId()).matches()
                || request.getSessionId().length() > MAX_SESSION_ID_LENGTH) {
            throw new InvalidRequestException("Invalid sessionId format");
        }
        for (ChatMessage msg : request.getMessages()) {
            if (msg == null || msg.getRole() == null || isBlank(msg.getContent()) || msg.getTimestamp() <= 0) {
                throw new InvalidRequestException("Invalid message format: missing role, content, or timestamp");
            }
            if (msg.getContent().length() > MAX_CONTENT_LENGTH) {
                throw new InvalidRequestException("Message content too long (limit: " + MAX_CONTENT_LENGTH + " characters)");
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static List<String> keyVariants(String sessionId) {
        return List.of(PREFIX + sessionId + GZIP_SUFFIX, PREFIX + sessionId + JSON_SUFFIX);
    }

    private static String sessionIdOf(String key) {
        if (key.equals(SessionIndexStore.KEY)) return null;
        String name = key.substring(PREFIX.length());
        if (name.contains("/")) return null;
        if (name.endsWith(GZIP_SUFFIX)) return name.substring(0, name.length() - GZIP_SUFFIX.length());
        if (name.endsWith(JSON_SUFFIX)) return name.substring(0, name.length() - JSON_SUFFIX.length());
        return null;
    }

    private byte[] encode(ChatSession session) {
        try {
            return mapper.writeValueAsBytes(session);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialize chat session " + session.getMetadata().getSessionId(), e);
        }
    }

    private ChatSession decode(byte[] body, String key) {
        try {
            return mapper.readValue(body, ChatSession.class);
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable chat session " + key, e);
        }
    }
}
