package com.soulsense.backend.modules.auth.domain;

/**
 * Login state machine. {@code UNAUTHENTICATED -> PASSWORD_VERIFIED -> AUTHENTICATED}, or via
 * {@code PRE_AUTH} when a second factor is pending.
 */
public enum AuthState {
    UNAUTHENTICATED(false),
    PASSWORD_VERIFIED(false),
    PRE_AUTH(false),
    AUTHENTICATED(true),
    INVALID_CREDENTIALS(true),
    ACCOUNT_DEACTIVATED(true),
    RATE_LIMITED(true),
    OTP_EXPIRED(true),
    OTP_MISMATCH(true),
    INVALID_TOKEN(true);

    private final boolean terminal;

    AuthState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isFailure() {
        return terminal && this != AUTHENTICATED;
    }
}
