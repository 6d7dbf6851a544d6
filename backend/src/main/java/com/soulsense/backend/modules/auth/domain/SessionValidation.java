package com.soulsense.backend.modules.auth.domain;

import java.util.UUID;

public record SessionValidation(boolean valid, String username, UUID userId) {

    private static final SessionValidation INVALID = new SessionValidation(false, null, null);

    public static SessionValidation invalid() {
        return INVALID;
    }

    public static SessionValidation valid(UserSession session) {
        return new SessionValidation(true, session.getUsername(), session.getUserId());
    }
}
