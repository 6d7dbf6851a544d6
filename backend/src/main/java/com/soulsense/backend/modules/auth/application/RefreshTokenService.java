package com.soulsense.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.soulsense.backend.global.error.ProblemException;
import com.soulsense.backend.modules.auth.domain.CredentialStore;
import com.soulsense.backend.modules.auth.domain.InvalidTokenException;
import com.soulsense.backend.modules.auth.domain.RefreshToken;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Opaque rotating refresh tokens. Only the SHA-256 digest of a token is persisted, and a token
 * resolves to its user at most once.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class RefreshTokenService {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenService.class);

    public static final String REASON_ROTATED = "ROTATED";
    public static final String REASON_LOGOUT = "LOGOUT";
    public static final String REASON_REVOKED = "REVOKED";
    public static final String REASON_PASSWORD_RESET = "PASSWORD_RESET";
    public static final String REASON_USER_INACTIVE = "USER_INACTIVE";
    public static final String REASON_EXPIRED = "EXPIRED";

    private final CredentialStore credentialStore;
    private final Clock clock;
    private final Duration ttl;

    public RefreshTokenService(
            CredentialStore credentialStore,
            Clock clock,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis
    ) {
        this.credentialStore = credentialStore;
        this.clock = clock;
        this.ttl = Duration.ofMillis(refreshTokenTtlMillis);
    }

    public String issue(UUID userId, String sessionId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String token = SecureTokens.newToken();
        credentialStore.saveRefreshToken(
                new RefreshToken(SecureTokens.sha256Hex(token), userId, sessionId, now, now.plus(ttl)));
        return token;
    }

    /**
     * Revokes {@code token} and issues its successor bound to the same session.
     *
     * @throws InvalidTokenException when the token is unknown, revoked, expired or was redeemed
     *         concurrently
     */
    public RefreshRedemption redeem(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Invalid refresh token");
        }
        String hash = SecureTokens.sha256Hex(token);
        RefreshToken stored = credentialStore.findRefreshTokenByHash(hash)
                .orElseThrow(() -> new InvalidTokenException("Invalid refresh token"));
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (stored.getRevokedAt() != null) {
            log.warn("Revoked refresh token presented userId={} reason={}", stored.getUserId(),
                    stored.getRevokedReason());
            throw new InvalidTokenException("Invalid refresh token");
        }
        if (!stored.isUsableAt(now)) {
            credentialStore.revokeRefreshToken(hash, now, REASON_EXPIRED);
            throw new InvalidTokenException("Refresh token expired");
        }
        if (!credentialStore.revokeRefreshToken(hash, now, REASON_ROTATED)) {
            throw new InvalidTokenException("Invalid refresh token");
        }

        String successor = issue(stored.getUserId(), stored.getSessionId());
        return new RefreshRedemption(stored.getUserId(), stored.getSessionId(), successor);
    }

    /** Unknown or already revoked tokens are ignored. */
    public boolean revoke(String token, String reason) {
        if (token == null || token.isBlank()) {
            return false;
        }
        return credentialStore.revokeRefreshToken(SecureTokens.sha256Hex(token), OffsetDateTime.now(clock), reason);
    }

    public int revokeForSession(String sessionId, String reason) {
        return credentialStore.revokeRefreshTokensForSession(sessionId, OffsetDateTime.now(clock), reason);
    }

    public int revokeAllForUser(UUID userId, String reason) {
        return credentialStore.revokeRefreshTokensForUser(userId, OffsetDateTime.now(clock), reason);
    }

    public Duration getTtl() {
        return ttl;
    }
}
