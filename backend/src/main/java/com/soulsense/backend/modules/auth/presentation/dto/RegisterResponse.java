package com.soulsense.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.soulsense.backend.modules.auth.domain.UserAccount;

public record RegisterResponse(UUID userId, String username, OffsetDateTime createdAt) {

    public static RegisterResponse from(UserAccount user) {
        return new RegisterResponse(user.getId(), user.getUsername(), user.getCreatedAt());
    }
}
