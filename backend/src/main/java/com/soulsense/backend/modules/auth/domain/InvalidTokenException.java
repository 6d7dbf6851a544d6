package com.soulsense.backend.modules.auth.domain;

/**
 * Raised for any malformed, tampered, expired, wrong-scope, revoked or replayed token.
 */
public class InvalidTokenException extends AuthException {

    public InvalidTokenException(String detail) {
        super(AuthErrorCode.INVALID_TOKEN, detail, null);
    }

    public InvalidTokenException(String detail, Throwable cause) {
        super(AuthErrorCode.INVALID_TOKEN, detail, cause);
    }
}
