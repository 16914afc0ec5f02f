package com.example.kiosksync.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/**
 * Local projection of a finished session: metadata only, used for fast listing.
 * {@code isStored} is false when archiving failed and the session awaits manual reconciliation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CachedChatSessionMeta {
    private String sessionId;
    private ChatSessionMetadata metadata;
    @JsonProperty("isStored")
    private boolean stored;
    private long localTimestamp;
}
