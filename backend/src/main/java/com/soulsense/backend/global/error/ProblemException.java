package com.soulsense.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

/**
 * Failure with a stable machine-readable code next to the HTTP status. The detail is the
 * caller-facing text; anything internal belongs in the cause and the logs.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, Throwable cause) {
        super(status, requireCode(code), cause);
        this.code = code;
        this.detail = StringUtils.hasText(detail) ? detail : status.getReasonPhrase();
    }

    public static ProblemException userNotFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found");
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    @Override
    public String getMessage() {
        return getStatusCode().value() + " " + code + ": " + detail;
    }

    private static String requireCode(String code) {
        if (!StringUtils.hasText(code)) {
            throw new IllegalArgumentException("problem code must not be blank");
        }
        return code;
    }
}
