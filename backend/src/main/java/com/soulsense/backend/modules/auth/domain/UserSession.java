package com.soulsense.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One authenticated client context. A user may hold any number of active sessions.
 * Rows are deactivated, never deleted.
 */
@Entity
@Table(name = "user_session")
public class UserSession {

    public static final int MAX_IP_ADDRESS_LENGTH = 64;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false, unique = true, length = 64)
    private String sessionId;

    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "username", nullable = false, updatable = false, length = 30)
    private String username;

    @Column(name = "ip_address", updatable = false, length = MAX_IP_ADDRESS_LENGTH)
    private String ipAddress;

    @Column(name = "user_agent", updatable = false, length = 255)
    private String userAgent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "last_accessed_at", nullable = false)
    private OffsetDateTime lastAccessedAt;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "logged_out_at")
    private OffsetDateTime loggedOutAt;

    protected UserSession() {
    }

    public UserSession(String sessionId, UUID userId, String username, String ipAddress, String userAgent,
                       OffsetDateTime createdAt) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.username = username;
        this.ipAddress = ipAddress == null || ipAddress.length() <= MAX_IP_ADDRESS_LENGTH
                ? ipAddress
                : ipAddress.substring(0, MAX_IP_ADDRESS_LENGTH);
        this.userAgent = userAgent;
        this.createdAt = createdAt;
        this.lastAccessedAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public String getSessionId() {
        return sessionId;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getUsername() {
        return username;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getLastAccessedAt() {
        return lastAccessedAt;
    }

    public void touch(OffsetDateTime at) {
        this.lastAccessedAt = at;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getLoggedOutAt() {
        return loggedOutAt;
    }

    public void deactivate(OffsetDateTime at) {
        if (active) {
            this.active = false;
            this.loggedOutAt = at;
        }
    }
}
