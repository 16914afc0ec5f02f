package com.example.kiosksync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattened wire form of a finished session, as posted to {@code /api/chat/save}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatSaveRequest {
    private String sessionId;
    private String avatarId;
    private String avatarName;
    private List<ChatMessage> messages;
    @JsonProperty("isKioskMode")
    private boolean kioskMode;
    private String location;
    private String userId;
    private String userName;

    public static ChatSaveRequest from(ActiveChatSession session) {
        return ChatSaveRequest.builder()
                .sessionId(session.getSessionId())
                .avatarId(session.getAvatarId())
                .avatarName(session.getAvatarName())
                .messages(List.copyOf(session.getMessages()))
                .kioskMode(session.isKioskMode())
                .location(session.getLocation())
                .userId(session.getUserId())
                .userName(session.getUserName())
                .build();
    }

    public ActiveChatSession toSession() {
        return ActiveChatSession.builder()
                .sessionId(sessionId)
                .avatarId(avatarId)
                .avatarName(avatarName)
                .messages(messages == null ? new ArrayList<>() : new ArrayList<>(messages))
                .kioskMode(kioskMode)
                .location(location)
                .userId(userId)
                .userName(userName)
                .build();
    }
}
