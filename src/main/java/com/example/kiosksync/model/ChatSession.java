package com.example.kiosksync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.time.Instant;
import java.util.List;

/**
 * An archived conversation. Immutable once written.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatSession {
    private ChatSessionMetadata metadata;
    private List<ChatMessage> messages;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Builds the archived form of a conversation. Start and end times come from the first and
     * last message timestamps, falling back to {@code now} for an empty message list.
     */
    public static ChatSession of(ActiveChatSession session, Instant now) {
        List<ChatMessage> messages = List.copyOf(session.getMessages());
        long startTime = messages.isEmpty() ? now.toEpochMilli() : messages.get(0).getTimestamp();
        long endTime = messages.isEmpty() ? now.toEpochMilli() : messages.get(messages.size() - 1).getTimestamp();

        ChatSessionMetadata metadata = ChatSessionMetadata.builder()
                .sessionId(session.getSessionId())
                .avatarId(session.getAvatarId())
                .avatarName(session.getAvatarName())
                .userId(session.getUserId())
                .userName(session.getUserName())
                .startTime(startTime)
                .endTime(endTime)
                .messageCount(messages.size())
                .kioskMode(session.isKioskMode())
                .location(session.getLocation())
                .build();

        return new ChatSession(metadata, messages, now, now);
    }
}
