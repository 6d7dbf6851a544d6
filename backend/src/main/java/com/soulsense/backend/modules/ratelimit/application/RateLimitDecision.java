package com.soulsense.backend.modules.ratelimit.application;

public record RateLimitDecision(boolean limited, int retryAfterSeconds) {

    private static final RateLimitDecision ALLOWED = new RateLimitDecision(false, 0);

    public static RateLimitDecision allowed() {
        return ALLOWED;
    }

    public static RateLimitDecision limited(int retryAfterSeconds) {
        return new RateLimitDecision(true, retryAfterSeconds);
    }
}
