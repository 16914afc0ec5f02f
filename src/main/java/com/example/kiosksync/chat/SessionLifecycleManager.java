package com.example.kiosksync.chat;

import com.example.kiosksync.error.*;
import com.example.kiosksync.gateway.ChatGateway;
import com.example.kiosksync.kv.KvClient;
import com.example.kiosksync.model.*;
import com.example.kiosksync.sync.VersionClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

/**
 * Owns the single active chat session of this edge process.
 * <p>
 * Idle &rarr; Active on {@link #start}, Active &rarr; Idle on {@link #end}, archiving as a side
 * effect. Every message is written through to the local KV so a crashed session can be
 * {@link #recover recovered} or ended later by id. A session whose archive call fails is parked
 * locally and only retried through {@link #retryParked}.
 */
public class SessionLifecycleManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionLifecycleManager.class);

    static final String RECOVERY_PREFIX = "chat:recovery:";
    static final String META_PREFIX = "chat:meta:";
    static final String PARKED_PREFIX = "chat:parked:";

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int ID_RANDOM_LENGTH = 9;

    private final ChatGateway gateway;
    private final KvClient kv;
    private final ObjectMapper mapper;
    private final VersionClock clock;
    private final Duration recoveryTtl;
    private final Duration flushTimeout;
    private final ExecutorService flushExecutor;
    private final SecureRandom random = new SecureRandom();

    private final Object lock = new Object();
    private ActiveChatSession active;

    public SessionLifecycleManager(ChatGateway gateway, KvClient kv, ObjectMapper mapper, VersionClock clock,
                                   Duration recoveryTtl, Duration flushTimeout) {
        this.gateway = gateway;
        this.kv = kv;
        this.mapper = mapper;
        this.clock = clock;
        this.recoveryTtl = recoveryTtl;
        this.flushTimeout = flushTimeout;
        this.flushExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "chat-flush-thread");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts a new session.
     *
     * @throws SessionAlreadyActiveException when a session is active; end it or use {@link #switchTo}
     */
    public ActiveChatSession start(String avatarId, String avatarName, StartOptions options) {
        if (avatarId == null || avatarId.isBlank()) {
            throw new InvalidRequestException("avatarId is required");
        }
        StartOptions opts = options == null ? new StartOptions() : options;
        synchronized (lock) {
            if (active != null) {
                logger.warn("Refusing to start a session for {} while {} is active", avatarId, active.getSessionId());
                throw new SessionAlreadyActiveException(active.getSessionId());
            }
            ActiveChatSession session = ActiveChatSession.builder()
                    .sessionId(newSessionId())
                    .avatarId(avatarId)
                    .avatarName(avatarName)
                    .startTime(clock.millis())
                    .kioskMode(opts.isKioskMode())
                    .userId(opts.getUserId())
                    .userName(opts.getUserName())
                    .location(opts.getLocation())
                    .build();
            writeRecovery(session);
            active = session;
            logger.info("Started chat session {} with {}", session.getSessionId(), avatarId);
            return session.copy();
        }
    }

    /**
     * Ends the active session, if any, and starts one for another avatar.
     */
    public ActiveChatSession switchTo(String avatarId, String avatarName, StartOptions options) {
        synchronized (lock) {
            if (active != null) {
                EndOutcome outcome = end(active.getSessionId());
                logger.info("Switching to {}: previous session ended as {}", avatarId, outcome);
            }
            return start(avatarId, avatarName, options);
        }
    }

    /**
     * Appends a message and writes the full session through to the recovery cache. The active
     * session only changes once that write succeeds, so a failed call can be retried as is.
     *
     * @throws NoActiveSessionException when idle
     */
    public ActiveChatSession addMessage(ChatMessage message) {
        if (message == null || message.getRole() == null || message.getContent() == null) {
            throw new InvalidRequestException("A message needs a role and content");
        }
        synchronized (lock) {
            if (active == null) {
                throw new NoActiveSessionException();
            }
            ChatMessage stamped = message.getTimestamp() > 0
                    ? message
                    : new ChatMessage(message.getRole(), message.getContent(), clock.millis());
            ActiveChatSession next = active.copy();
            next.getMessages().add(stamped);
            writeRecovery(next);
            active = next;
            logger.debug("Session {}: {} message #{}", active.getSessionId(), stamped.getRole(), active.getMessages().size());
            return active.copy();
        }
    }

    public Optional<ActiveChatSession> active() {
        synchronized (lock) {
            return Optional.ofNullable(active).map(ActiveChatSession::copy);
        }
    }

    /** Ends the active session. */
    public EndOutcome end() {
        return end(null);
    }

    /**
     * Ends a session: the active one when {@code sessionId} is null or matches it, otherwise the
     * recovery cache entry of that id. Never throws.
     */
    public EndOutcome end(String sessionId) {
        synchronized (lock) {
            ActiveChatSession target;
            try {
                target = resolve(sessionId);
            } catch (RuntimeException e) {
                logger.error("Could not read recovery entry of chat session {}", sessionId, e);
                return EndOutcome.NOT_FOUND;
            }
            if (target == null) {
                logger.info("No active or recoverable chat session {} to end", sessionId == null ? "" : sessionId);
                return EndOutcome.NOT_FOUND;
            }
            String id = target.getSessionId();

            if (target.getMessages().isEmpty()) {
                clear(id);
                logger.info("Discarded empty chat session {}", id);
                return EndOutcome.DISCARDED_EMPTY;
            }

            ChatSession session = ChatSession.of(target, clock.now());
            boolean keepRecovery = false;
            try {
                archive(target);
            } catch (RuntimeException e) {
                ArchiveFailureException failure = new ArchiveFailureException(id, e);
                logger.error("{}, parking it for manual retry", failure.getMessage(), failure);
                keepRecovery = !park(target, session.getMetadata());
                return EndOutcome.ARCHIVE_FAILED;
            } finally {
                if (keepRecovery) {
                    releaseSlot(id);
                } else {
                    clear(id);
                }
            }
            try {
                writeMeta(session.getMetadata(), true);
            } catch (RuntimeException e) {
                logger.warn("Chat session {} archived but its local metadata was not cached: {}", id, e.getMessage());
            }
            logger.info("Ended chat session {} with {} messages", id, target.getMessages().size());
            return EndOutcome.ARCHIVED;
        }
    }

    /**
     * Restores a session from the recovery cache and makes it the active one.
     *
     * @return false when nothing is cached under that id
     * @throws SessionAlreadyActiveException when another session is active
     */
    public boolean recover(String sessionId) {
        synchronized (lock) {
            if (active != null && active.getSessionId().equals(sessionId)) {
                return true;
            }
            Optional<ActiveChatSession> cached = readSession(RECOVERY_PREFIX + sessionId);
            if (cached.isEmpty()) {
                return false;
            }
            if (active != null) {
                throw new SessionAlreadyActiveException(active.getSessionId());
            }
            active = cached.get();
            logger.info("Recovered chat session {} with {} messages", sessionId, active.getMessages().size());
            return true;
        }
    }

    /** Session ids that can be recovered or ended after a restart. */
    public List<String> recoverableSessionIds() {
        return idsUnder(RECOVERY_PREFIX);
    }

    /**
     * Ends the active session, waiting at most {@code timeout}. On timeout the archive call keeps
     * running and the recovery entry stays until it completes.
     */
    public EndOutcome flush(Duration timeout) {
        CompletableFuture<EndOutcome> pending = CompletableFuture.supplyAsync(this::end, flushExecutor);
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Flushing the active chat session timed out after {}ms", timeout.toMillis());
            return EndOutcome.TIMED_OUT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while flushing the active chat session");
            return EndOutcome.TIMED_OUT;
        } catch (ExecutionException e) {
            logger.error("Flushing the active chat session failed", e.getCause());
            return EndOutcome.ARCHIVE_FAILED;
        }
    }

    @PreDestroy
    public void shutdown() {
        EndOutcome outcome = flush(flushTimeout);
        logger.info("Chat session flush on shutdown: {}", outcome);
        flushExecutor.shutdown();
    }

    /**
     * Locally cached session metadata, newest first.
     */
    public List<CachedChatSessionMeta> listCachedSessions(String avatarId, String userId, Integer limit) {
        List<String> keys = kv.scanAll(META_PREFIX);
        if (keys.isEmpty()) return new ArrayList<>();
        return kv.mget(keys).values().stream()
                .filter(Objects::nonNull)
                .map(this::decodeMeta)
                .filter(Objects::nonNull)
                .filter(m -> avatarId == null || avatarId.equals(m.getMetadata().getAvatarId()))
                .filter(m -> userId == null || userId.equals(m.getMetadata().getUserId()))
                .sorted(Comparator.comparingLong((CachedChatSessionMeta m) -> m.getMetadata().getStartTime()).reversed())
                .limit(limit == null || limit < 0 ? Long.MAX_VALUE : limit)
                .collect(Collectors.toList());
    }

    public List<String> parkedSessionIds() {
        return idsUnder(PARKED_PREFIX);
    }

    /**
     * Archives a parked session again.
     */
    public EndOutcome retryParked(String sessionId) {
        synchronized (lock) {
            Optional<ActiveChatSession> parked = readSession(PARKED_PREFIX + sessionId);
            if (parked.isEmpty()) {
                return EndOutcome.NOT_FOUND;
            }
            try {
                archive(parked.get());
            } catch (RuntimeException e) {
                logger.warn("Retry of parked chat session {} failed: {}", sessionId, e.getMessage());
                return EndOutcome.ARCHIVE_FAILED;
            }
            kv.del(PARKED_PREFIX + sessionId);
            writeMeta(ChatSession.of(parked.get(), clock.now()).getMetadata(), true);
            logger.info("Archived parked chat session {}", sessionId);
            return EndOutcome.ARCHIVED;
        }
    }

    /**
     * Deletes a session from the archive and from every local cache.
     *
     * @throws NotFoundException when it exists neither remotely nor locally
     */
    public void deleteSession(String sessionId) {
        boolean local = kv.get(META_PREFIX + sessionId).isPresent()
                || kv.get(PARKED_PREFIX + sessionId).isPresent()
                || kv.get(RECOVERY_PREFIX + sessionId).isPresent();
        try {
            gateway.delete(sessionId);
        } catch (NotFoundException e) {
            if (!local) throw e;
        }
        synchronized (lock) {
            kv.del(META_PREFIX + sessionId);
            kv.del(PARKED_PREFIX + sessionId);
            clear(sessionId);
        }
        logger.info("Deleted chat session {}", sessionId);
    }

    /**
     * Drops cached metadata and recovery entries. Parked sessions are kept: they exist nowhere
     * else.
     *
     * @return number of removed entries
     */
    public int clearLocalCache() {
        int removed = 0;
        synchronized (lock) {
            for (String prefix : List.of(META_PREFIX, RECOVERY_PREFIX)) {
                for (String key : kv.scanAll(prefix)) {
                    if (active != null && key.equals(RECOVERY_PREFIX + active.getSessionId())) continue;
                    kv.del(key);
                    removed++;
                }
            }
        }
        logger.info("Cleared {} local chat cache entries", removed);
        return removed;
    }

    private ActiveChatSession resolve(String sessionId) {
        if (active != null && (sessionId == null || active.getSessionId().equals(sessionId))) {
            return active;
        }
        if (sessionId == null) {
            return null;
        }
        return readSession(RECOVERY_PREFIX + sessionId).orElse(null);
    }

    private void archive(ActiveChatSession session) {
        try {
            gateway.save(ChatSaveRequest.from(session));
        } catch (DuplicateEntityException e) {
            logger.info("Chat session {} was archived already", session.getSessionId());
        }
    }

    private boolean park(ActiveChatSession session, ChatSessionMetadata metadata) {
        try {
            kv.set(PARKED_PREFIX + session.getSessionId(), mapper.writeValueAsString(session));
            writeMeta(metadata, false);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.error("Could not park chat session {}, keeping its recovery entry", session.getSessionId(), e);
            return false;
        }
    }

    private void clear(String sessionId) {
        try {
            kv.del(RECOVERY_PREFIX + sessionId);
        } catch (RuntimeException e) {
            logger.warn("Could not drop recovery entry of chat session {}: {}", sessionId, e.getMessage());
        }
        releaseSlot(sessionId);
    }

    private void releaseSlot(String sessionId) {
        if (active != null && active.getSessionId().equals(sessionId)) {
            active = null;
        }
    }

    private void writeRecovery(ActiveChatSession session) {
        try {
            kv.set(RECOVERY_PREFIX + session.getSessionId(), mapper.writeValueAsString(session), recoveryTtl);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialize chat session " + session.getSessionId(), e);
        }
    }

    private void writeMeta(ChatSessionMetadata metadata, boolean stored) {
        CachedChatSessionMeta meta = new CachedChatSessionMeta(metadata.getSessionId(), metadata, stored, clock.millis());
        try {
            kv.set(META_PREFIX + metadata.getSessionId(), mapper.writeValueAsString(meta));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialize metadata of " + metadata.getSessionId(), e);
        }
    }

    private Optional<ActiveChatSession> readSession(String key) {
        return kv.get(key).map(json -> {
            try {
                return mapper.readValue(json, ActiveChatSession.class);
            } catch (IOException e) {
                throw new IllegalStateException("Corrupt chat cache entry " + key, e);
            }
        });
    }

    private CachedChatSessionMeta decodeMeta(String json) {
        try {
            return mapper.readValue(json, CachedChatSessionMeta.class);
        } catch (IOException e) {
            logger.warn("Skipping corrupt chat metadata entry: {}", e.getMessage());
            return null;
        }
    }

    private List<String> idsUnder(String prefix) {
        return kv.scanAll(prefix).stream()
                .map(k -> k.substring(prefix.length()))
                .sorted()
                .collect(Collectors.toList());
    }

    private String newSessionId() {
        StringBuilder id = new StringBuilder().append(clock.millis()).append('_');
        for (int i = 0; i < ID_RANDOM_LENGTH; i++) {
            id.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return id.toString();
    }
}
