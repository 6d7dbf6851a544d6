package com.soulsense.backend.modules.auth.application;

import java.util.UUID;

public record RefreshRedemption(UUID userId, String sessionId, String newRefreshToken) {
}
