package com.example.kiosksync.model;

import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionFilter {
    private String avatarId;
    private String userId;
    private Instant startDate;
    private Instant endDate;
    private Integer limit;

    public static SessionFilter all() {
        return new SessionFilter();
    }

    public boolean matches(ChatSessionMetadata meta) {
        if (avatarId != null && !avatarId.equals(meta.getAvatarId())) return false;
        if (userId != null && !userId.equals(meta.getUserId())) return false;
        if (startDate != null && meta.getStartTime() < startDate.toEpochMilli()) return false;
        if (endDate != null && meta.getEndTime() > endDate.toEpochMilli()) return false;
        return true;
    }
}
