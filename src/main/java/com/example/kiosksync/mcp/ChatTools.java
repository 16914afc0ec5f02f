package com.example.kiosksync.mcp;

import com.example.kiosksync.chat.SessionLifecycleManager;
import com.example.kiosksync.error.InvalidRequestException;
import com.example.kiosksync.gateway.ChatGateway;
import com.example.kiosksync.model.ActiveChatSession;
import com.example.kiosksync.model.ChatMessage;
import com.example.kiosksync.model.EndOutcome;
import com.example.kiosksync.model.SessionFilter;
import com.example.kiosksync.model.StartOptions;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class ChatTools {

    private final SessionLifecycleManager sessions;
    private final ChatGateway chatGateway;

    public ChatTools(SessionLifecycleManager sessions, ChatGateway chatGateway) {
        this.sessions = sessions;
        this.chatGateway = chatGateway;
    }

    @Tool(description = "Start a chat session with an avatar; fails if one is already active")
    public Map<String,Object> chat_start(String avatarId, String avatarName, String userId, String userName,
                                         Boolean kioskMode, String location) {
        return session(sessions.start(avatarId, avatarName, options(userId, userName, kioskMode, location)));
    }

    @Tool(description = "End the active chat session, if any, and start one with another avatar")
    public Map<String,Object> chat_switch(String avatarId, String avatarName, String userId, String userName,
                                          Boolean kioskMode, String location) {
        return session(sessions.switchTo(avatarId, avatarName, options(userId, userName, kioskMode, location)));
    }

    @Tool(description = "Append a message (role user or assistant) to the active chat session")
    public Map<String,Object> chat_add_message(String role, String content) {
        ChatMessage.Role parsed;
        try {
            parsed = ChatMessage.Role.valueOf(String.valueOf(role).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Invalid message role: must be 'user' or 'assistant'");
        }
        return session(sessions.addMessage(new ChatMessage(parsed, content, 0L)));
    }

    @Tool(description = "End a chat session (the active one when sessionId is empty) and archive it")
    public Map<String,Object> chat_end(String sessionId) {
        EndOutcome outcome = sessions.end(sessionId == null || sessionId.isBlank() ? null : sessionId);
        return Map.of("outcome", outcome.name());
    }

    @Tool(description = "Restore a chat session from the crash-recovery cache")
    public Map<String,Object> chat_recover(String sessionId) {
        return Map.of("recovered", sessions.recover(sessionId));
    }

    @Tool(description = "Show the active chat session and sessions waiting in the recovery cache")
    public Map<String,Object> chat_active() {
        Map<String, Object> result = new HashMap<>();
        result.put("active", sessions.active().orElse(null));
        result.put("recoverable", sessions.recoverableSessionIds());
        return result;
    }

    @Tool(description = "List locally cached chat session metadata")
    public Map<String,Object> chat_list_cached(String avatarId, String userId, Integer limit) {
        return Map.of("sessions", sessions.listCachedSessions(avatarId, userId, limit));
    }

    @Tool(description = "List archived chat sessions from the index")
    public Map<String,Object> chat_list_archived(String avatarId, String userId, Integer limit) {
        SessionFilter filter = SessionFilter.builder().avatarId(avatarId).userId(userId).limit(limit).build();
        return Map.of("sessions", chatGateway.list(filter));
    }

    @Tool(description = "Get an archived chat session with its messages")
    public Map<String,Object> chat_get(String sessionId) {
        Map<String, Object> result = new HashMap<>();
        result.put("sessionId", sessionId);
        result.put("session", chatGateway.get(sessionId).orElse(null));
        return result;
    }

    @Tool(description = "List chat sessions whose archiving failed and that wait for a manual retry")
    public Map<String,Object> chat_list_parked() {
        List<String> parked = sessions.parkedSessionIds();
        return Map.of("sessions", parked, "count", parked.size());
    }

    @Tool(description = "Retry archiving a parked chat session")
    public Map<String,Object> chat_retry_parked(String sessionId) {
        return Map.of("outcome", sessions.retryParked(sessionId).name());
    }

    @Tool(description = "Delete a chat session from the archive and the local cache")
    public Map<String,Object> chat_delete(String sessionId) {
        sessions.deleteSession(sessionId);
        return Map.of("ok", true, "sessionId", sessionId);
    }

    @Tool(description = "Clear cached chat metadata and stale recovery entries; parked sessions are kept")
    public Map<String,Object> chat_clear_local_cache() {
        return Map.of("removed", sessions.clearLocalCache());
    }

    private static StartOptions options(String userId, String userName, Boolean kioskMode, String location) {
        return StartOptions.builder()
                .userId(userId)
                .userName(userName)
                .kioskMode(Boolean.TRUE.equals(kioskMode))
                .location(location)
                .build();
    }

    private static Map<String, Object> session(ActiveChatSession session) {
        Map<String, Object> result = new HashMap<>();
        result.put("sessionId", session.getSessionId());
        result.put("avatarId", session.getAvatarId());
        result.put("messageCount", session.getMessages().size());
        result.put("startTime", session.getStartTime());
        return result;
    }
}
