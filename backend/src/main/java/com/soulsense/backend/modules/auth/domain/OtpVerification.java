package com.soulsense.backend.modules.auth.domain;

public enum OtpVerification {
    VERIFIED,
    MISMATCH,
    EXPIRED,
    NOT_FOUND;

    public boolean isVerified() {
        return this == VERIFIED;
    }
}
