package com.soulsense.backend.modules.auth.domain;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes of the identity flows. Authentication failures carry a generic public message
 * that is the same whether or not the account exists.
 */
public enum AuthErrorCode {
    INVALID_CREDENTIALS("AUTH001", HttpStatus.UNAUTHORIZED, "Incorrect username or password"),
    ACCOUNT_DEACTIVATED("AUTH003", HttpStatus.FORBIDDEN, "Authentication failed"),
    RATE_LIMITED("AUTH004", HttpStatus.TOO_MANY_REQUESTS, "Too many requests"),
    OTP_EXPIRED("AUTH005", HttpStatus.BAD_REQUEST, "Verification code expired"),
    OTP_MISMATCH("AUTH006", HttpStatus.BAD_REQUEST, "Invalid verification code"),
    INVALID_TOKEN("AUTH007", HttpStatus.UNAUTHORIZED, "Invalid or expired token"),
    USERNAME_TAKEN("REG001", HttpStatus.CONFLICT, "Username already taken"),
    EMAIL_TAKEN("REG002", HttpStatus.CONFLICT, "Email already registered"),
    VALIDATION("VAL001", HttpStatus.UNPROCESSABLE_ENTITY, "Validation failed");

    private final String code;
    private final HttpStatus status;
    private final String publicMessage;

    AuthErrorCode(String code, HttpStatus status, String publicMessage) {
        this.code = code;
        this.status = status;
        this.publicMessage = publicMessage;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getPublicMessage() {
        return publicMessage;
    }

    public static AuthErrorCode forState(AuthState state) {
        return switch (state) {
            case INVALID_CREDENTIALS -> INVALID_CREDENTIALS;
            case ACCOUNT_DEACTIVATED -> ACCOUNT_DEACTIVATED;
            case RATE_LIMITED -> RATE_LIMITED;
            case OTP_EXPIRED -> OTP_EXPIRED;
            case OTP_MISMATCH -> OTP_MISMATCH;
            case INVALID_TOKEN -> INVALID_TOKEN;
            default -> null;
        };
    }
}
