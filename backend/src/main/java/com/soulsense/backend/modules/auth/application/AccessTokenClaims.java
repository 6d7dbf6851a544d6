package com.soulsense.backend.modules.auth.application;

import java.util.Objects;
import java.util.UUID;

import com.soulsense.backend.modules.auth.domain.TokenScope;

/**
 * Claims signed into an access or pre-auth token. {@code username} and {@code sessionId} are
 * absent from pre-auth tokens.
 */
public record AccessTokenClaims(UUID userId, String username, String sessionId, TokenScope scope) {

    public AccessTokenClaims {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(scope, "scope is required");
    }

    public static AccessTokenClaims access(UUID userId, String username, String sessionId) {
        return new AccessTokenClaims(userId, username, sessionId, TokenScope.ACCESS);
    }

    public static AccessTokenClaims preAuth(UUID userId) {
        return new AccessTokenClaims(userId, null, null, TokenScope.PRE_AUTH);
    }
}
