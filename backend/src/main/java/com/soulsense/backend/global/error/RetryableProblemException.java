package com.soulsense.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Problem the caller may retry after a wait. Rendered with a {@code Retry-After} header.
 */
public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, int retryAfterSeconds) {
        super(status, code, detail);
        // never below one second
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public String retryAfterHeaderValue() {
        return Integer.toString(retryAfterSeconds);
    }
}
