package com.soulsense.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.soulsense.backend.modules.auth.domain.AuthState;
import com.soulsense.backend.modules.auth.domain.LoginResult;

/**
 * {@code tokens} is present for {@code AUTHENTICATED}, {@code preAuthToken} for {@code PRE_AUTH}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResponse(
        AuthState state,
        UUID userId,
        String username,
        TokenPairResponse tokens,
        String preAuthToken
) {

    public static LoginResponse from(LoginResult result) {
        return new LoginResponse(
                result.state(),
                result.userId(),
                result.username(),
                result.tokens() != null ? TokenPairResponse.from(result.tokens()) : null,
                result.preAuthToken()
        );
    }
}
