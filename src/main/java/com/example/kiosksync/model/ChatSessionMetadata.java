package com.example.kiosksync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatSessionMetadata {
    private String sessionId;
    private String avatarId;
    private String avatarName;
    private String userId;
    private String userName;
    private long startTime;
    private long endTime;
    private int messageCount;
    @JsonProperty("isKioskMode")
    private boolean kioskMode;
    private String location;
}
