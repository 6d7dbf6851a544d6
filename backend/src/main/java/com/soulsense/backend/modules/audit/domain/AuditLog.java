package com.soulsense.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Immutable
@Table(name = "audit_log")
public class AuditLog {

    public static final int MAX_USER_AGENT_LENGTH = 255;
    public static final int MAX_IP_ADDRESS_LENGTH = 64;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_id", updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 64)
    private AuditAction action;

    @Column(name = "ip_address", updatable = false, length = MAX_IP_ADDRESS_LENGTH)
    private String ipAddress;

    @Column(name = "user_agent", updatable = false, length = MAX_USER_AGENT_LENGTH)
    private String userAgent;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "details", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> details;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected AuditLog() {
    }

    public AuditLog(UUID userId, AuditAction action, String ipAddress, String userAgent,
                    Map<String, Object> details, OffsetDateTime createdAt) {
        this.userId = userId;
        this.action = action;
        this.ipAddress = ipAddress == null || ipAddress.length() <= MAX_IP_ADDRESS_LENGTH
                ? ipAddress
                : ipAddress.substring(0, MAX_IP_ADDRESS_LENGTH);
        this.userAgent = userAgent;
        this.details = details;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public AuditAction getAction() {
        return action;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
