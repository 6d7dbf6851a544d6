package com.soulsense.backend.modules.ratelimit.application;

import com.soulsense.backend.global.error.RetryableProblemException;

import org.springframework.http.HttpStatus;

public class RateLimitedException extends RetryableProblemException {

    public static final String CODE = "AUTH004";

    private final RateLimitFamily family;

    public RateLimitedException(RateLimitFamily family, int retryAfterSeconds) {
        super(HttpStatus.TOO_MANY_REQUESTS, CODE,
                "Too many requests. Please wait " + retryAfterSeconds + "s before trying again.",
                retryAfterSeconds);
        this.family = family;
    }

    public RateLimitFamily getFamily() {
        return family;
    }
}
