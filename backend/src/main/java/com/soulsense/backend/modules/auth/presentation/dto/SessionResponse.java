package com.soulsense.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.soulsense.backend.modules.auth.domain.UserSession;

public record SessionResponse(
        String sessionId,
        String ipAddress,
        String userAgent,
        OffsetDateTime createdAt,
        OffsetDateTime lastAccessedAt,
        boolean current
) {

    public static SessionResponse from(UserSession session, String currentSessionId) {
        return new SessionResponse(
                session.getSessionId(),
                session.getIpAddress(),
                session.getUserAgent(),
                session.getCreatedAt(),
                session.getLastAccessedAt(),
                session.getSessionId().equals(currentSessionId)
        );
    }
}
