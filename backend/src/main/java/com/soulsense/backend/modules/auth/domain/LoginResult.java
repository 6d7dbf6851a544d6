package com.soulsense.backend.modules.auth.domain;

import java.util.UUID;

/**
 * Outcome of a login step. {@code sessionId} and {@code tokens} are set only when
 * {@link AuthState#AUTHENTICATED}; {@code preAuthToken} only when {@link AuthState#PRE_AUTH}.
 */
public record LoginResult(
        AuthState state,
        UUID userId,
        String username,
        String sessionId,
        TokenPair tokens,
        String preAuthToken,
        AuthErrorCode errorCode,
        int retryAfterSeconds
) {

    public static LoginResult authenticated(UserAccount user, String sessionId, TokenPair tokens) {
        return new LoginResult(AuthState.AUTHENTICATED, user.getId(), user.getUsername(), sessionId, tokens, null, null, 0);
    }

    public static LoginResult preAuth(UserAccount user, String preAuthToken) {
        return new LoginResult(AuthState.PRE_AUTH, user.getId(), user.getUsername(), null, null, preAuthToken, null, 0);
    }

    public static LoginResult failed(AuthState state) {
        return new LoginResult(state, null, null, null, null, null, AuthErrorCode.forState(state), 0);
    }

    public static LoginResult rateLimited(int retryAfterSeconds) {
        return new LoginResult(AuthState.RATE_LIMITED, null, null, null, null, null, AuthErrorCode.RATE_LIMITED,
                retryAfterSeconds);
    }

    public boolean success() {
        return state == AuthState.AUTHENTICATED || state == AuthState.PRE_AUTH;
    }
}
