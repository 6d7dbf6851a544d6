package com.soulsense.backend.global.security;

import java.util.UUID;

public record AuthenticatedUser(UUID userId, String username, String sessionId) {
}
