package com.soulsense.backend.modules.auth.domain;

import java.time.OffsetDateTime;

public record TokenPair(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn,
        OffsetDateTime issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}
