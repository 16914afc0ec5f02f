package com.example.kiosksync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Avatar implements SyncEntity {
    private String id;
    private String name;
    private String title;
    private String systemPrompt;
    private List<ConversationStarter> conversationStarters;
    private List<String> topics;
    private String portrait;
    private String description;
    private Boolean published;

    // Session settings handed to the streaming-avatar vendor, kept opaque
    private Map<String, Object> settings;

    private String createdBy;
    private Instant createdAt;
    private String lastEditedBy;
    private Instant lastEditedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ConversationStarter {
        private String title;
        private String prompt;
    }
}
