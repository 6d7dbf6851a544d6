package com.soulsense.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

/**
 * Append-only record of one authentication attempt.
 */
@Entity
@Immutable
@Table(name = "login_attempt")
public class LoginAttempt {

    public static final String REASON_INVALID_CREDENTIALS = "invalid_credentials";
    public static final String REASON_ACCOUNT_DEACTIVATED = "account_deactivated";
    public static final String REASON_RATE_LIMITED = "rate_limited";
    public static final String REASON_OTP_MISMATCH = "otp_mismatch";
    public static final String REASON_OTP_EXPIRED = "otp_expired";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "identifier", nullable = false, updatable = false, length = 320)
    private String identifier;

    @Column(name = "is_successful", nullable = false, updatable = false)
    private boolean successful;

    @Column(name = "failure_reason", updatable = false, length = 64)
    private String failureReason;

    @Column(name = "ip_address", updatable = false, length = 64)
    private String ipAddress;

    @Column(name = "user_agent", updatable = false, length = 255)
    private String userAgent;

    @Column(name = "attempted_at", nullable = false, updatable = false)
    private OffsetDateTime attemptedAt;

    protected LoginAttempt() {
    }

    private LoginAttempt(String identifier, boolean successful, String failureReason, String ipAddress,
                         String userAgent, OffsetDateTime attemptedAt) {
        this.identifier = cut(identifier == null ? "" : identifier, 320);
        this.successful = successful;
        this.failureReason = failureReason;
        this.ipAddress = cut(ipAddress, 64);
        this.userAgent = cut(userAgent, 255);
        this.attemptedAt = attemptedAt;
    }

    private static String cut(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }

    public static LoginAttempt success(String identifier, String ipAddress, String userAgent, OffsetDateTime at) {
        return new LoginAttempt(identifier, true, null, ipAddress, userAgent, at);
    }

    public static LoginAttempt failure(String identifier, String reason, String ipAddress, String userAgent,
                                       OffsetDateTime at) {
        return new LoginAttempt(identifier, false, reason, ipAddress, userAgent, at);
    }

    public UUID getId() {
        return id;
    }

    public String getIdentifier() {
        return identifier;
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public OffsetDateTime getAttemptedAt() {
        return attemptedAt;
    }
}
