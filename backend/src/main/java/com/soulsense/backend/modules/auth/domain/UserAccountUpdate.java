package com.soulsense.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * The complete set of changes a {@link UserAccount} accepts after registration.
 * Absent fields are left untouched. An empty otp secret clears the stored one.
 */
public record UserAccountUpdate(
        Optional<String> passwordHash,
        Optional<Boolean> active,
        Optional<Boolean> twoFactorEnabled,
        Optional<String> otpSecret,
        Optional<OffsetDateTime> lastLoginAt
) {

    public UserAccountUpdate {
        passwordHash = passwordHash != null ? passwordHash : Optional.empty();
        active = active != null ? active : Optional.empty();
        twoFactorEnabled = twoFactorEnabled != null ? twoFactorEnabled : Optional.empty();
        otpSecret = otpSecret != null ? otpSecret : Optional.empty();
        lastLoginAt = lastLoginAt != null ? lastLoginAt : Optional.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static UserAccountUpdate passwordHash(String passwordHash) {
        return builder().passwordHash(passwordHash).build();
    }

    public static UserAccountUpdate lastLogin(OffsetDateTime at) {
        return builder().lastLoginAt(at).build();
    }

    public static UserAccountUpdate twoFactor(boolean enabled) {
        return builder().twoFactorEnabled(enabled).build();
    }

    public static UserAccountUpdate deactivate() {
        return builder().active(false).build();
    }

    public static final class Builder {

        private String passwordHash;
        private Boolean active;
        private Boolean twoFactorEnabled;
        private String otpSecret;
        private OffsetDateTime lastLoginAt;

        private Builder() {
        }

        public Builder passwordHash(String passwordHash) {
            this.passwordHash = passwordHash;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder twoFactorEnabled(boolean twoFactorEnabled) {
            this.twoFactorEnabled = twoFactorEnabled;
            return this;
        }

        public Builder otpSecret(String otpSecret) {
            this.otpSecret = otpSecret;
            return this;
        }

        public Builder lastLoginAt(OffsetDateTime lastLoginAt) {
            this.lastLoginAt = lastLoginAt;
            return this;
        }

        public UserAccountUpdate build() {
            return new UserAccountUpdate(
                    Optional.ofNullable(passwordHash),
                    Optional.ofNullable(active),
                    Optional.ofNullable(twoFactorEnabled),
                    Optional.ofNullable(otpSecret),
                    Optional.ofNullable(lastLoginAt)
            );
        }
    }
}
