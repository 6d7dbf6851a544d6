package com.soulsense.backend.global.security;

import java.util.UUID;

import com.soulsense.backend.modules.auth.domain.AuthErrorCode;
import com.soulsense.backend.modules.auth.domain.AuthException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Access to the caller resolved by {@link SessionAuthenticationFilter}.
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static AuthenticatedUser getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser principal) {
            return principal;
        }
        throw new AuthException(AuthErrorCode.INVALID_TOKEN);
    }

    public static UUID getCurrentUserId() {
        return getCurrentUser().userId();
    }

    public static String getCurrentSessionId() {
        return getCurrentUser().sessionId();
    }
}
