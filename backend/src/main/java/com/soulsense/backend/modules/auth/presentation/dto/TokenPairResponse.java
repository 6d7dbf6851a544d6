package com.soulsense.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.soulsense.backend.modules.auth.domain.TokenPair;

public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn,
        OffsetDateTime issuedAt
) {

    public static TokenPairResponse from(TokenPair tokens) {
        return new TokenPairResponse(
                tokens.accessToken(),
                tokens.tokenType(),
                tokens.expiresIn(),
                tokens.refreshToken(),
                tokens.refreshExpiresIn(),
                tokens.issuedAt()
        );
    }
}
