package com.soulsense.backend.modules.ratelimit.application;

/**
 * Endpoint families with their own, independent request budgets.
 */
public enum RateLimitFamily {
    LOGIN("login"),
    REGISTRATION("registration"),
    PASSWORD_RESET("password-reset"),
    ANALYTICS("analytics"),
    OTP_ISSUE("otp-issue"),
    OTP_VERIFY("otp-verify");

    private final String propertyKey;

    RateLimitFamily(String propertyKey) {
        this.propertyKey = propertyKey;
    }

    public String getPropertyKey() {
        return propertyKey;
    }
}
