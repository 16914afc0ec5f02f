package com.example.kiosksync.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessage {
    private Role role;
    private String content;
    // epoch millis
    private long timestamp;

    public enum Role {
        @JsonProperty("user") USER,
        @JsonProperty("assistant") ASSISTANT
    }

    public static ChatMessage user(String content, long timestamp) {
        return new ChatMessage(Role.USER, content, timestamp);
    }

    public static ChatMessage assistant(String content, long timestamp) {
        return new ChatMessage(Role.ASSISTANT, content, timestamp);
    }
}
