package com.soulsense.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Login identity. Accounts are deactivated, never deleted; every change after creation goes
 * through {@link #apply(UserAccountUpdate, OffsetDateTime)}.
 */
@Entity
@Table(name = "user_account")
public class UserAccount {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "username", nullable = false, updatable = false, length = 30)
    private String username;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "is_2fa_enabled", nullable = false)
    private boolean twoFactorEnabled;

    @Column(name = "otp_secret", length = 255)
    private String otpSecret;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "last_login_at")
    private OffsetDateTime lastLoginAt;

    @Column(name = "deactivated_at")
    private OffsetDateTime deactivatedAt;

    protected UserAccount() {
    }

    public UserAccount(String username, String passwordHash, OffsetDateTime createdAt) {
        this.username = username;
        this.passwordHash = passwordHash;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public void apply(UserAccountUpdate update, OffsetDateTime now) {
        update.passwordHash().ifPresent(hash -> this.passwordHash = hash);
        update.active().ifPresent(flag -> {
            if (this.active && !flag) {
                this.deactivatedAt = now;
            } else if (flag) {
                this.deactivatedAt = null;
            }
            this.active = flag;
        });
        update.twoFactorEnabled().ifPresent(flag -> this.twoFactorEnabled = flag);
        update.otpSecret().ifPresent(secret -> this.otpSecret = secret.isEmpty() ? null : secret);
        update.lastLoginAt().ifPresent(at -> this.lastLoginAt = at);
        this.updatedAt = now;
    }

    public UUID getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public boolean isActive() {
        return active;
    }

    public boolean isTwoFactorEnabled() {
        return twoFactorEnabled;
    }

    public String getOtpSecret() {
        return otpSecret;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public OffsetDateTime getLastLoginAt() {
        return lastLoginAt;
    }

    public OffsetDateTime getDeactivatedAt() {
        return deactivatedAt;
    }
}
