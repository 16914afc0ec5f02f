package com.example.kiosksync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * The in-memory, not yet archived conversation. The same shape is written to the
 * crash-recovery cache after every message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActiveChatSession {
    private String sessionId;
    private String avatarId;
    private String avatarName;
    @Builder.Default
    private List<ChatMessage> messages = new ArrayList<>();
    private long startTime;
    @JsonProperty("isKioskMode")
    private boolean kioskMode;
    private String userId;
    private String userName;
    private String location;

    public ActiveChatSession copy() {
        return toBuilder().messages(new ArrayList<>(messages)).build();
    }
}
