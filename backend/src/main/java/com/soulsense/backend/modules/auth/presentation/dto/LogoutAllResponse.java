package com.soulsense.backend.modules.auth.presentation.dto;

public record LogoutAllResponse(int sessionsRevoked) {
}
