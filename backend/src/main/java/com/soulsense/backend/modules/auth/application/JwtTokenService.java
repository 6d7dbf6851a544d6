package com.soulsense.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.soulsense.backend.modules.auth.domain.InvalidTokenException;
import com.soulsense.backend.modules.auth.domain.TokenPair;
import com.soulsense.backend.modules.auth.domain.TokenScope;
import com.soulsense.backend.modules.auth.domain.UserAccount;
import com.soulsense.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    static final String CLAIM_SCOPE = "scope";
    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_SESSION_ID = "sid";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final long refreshTokenTtlMillis;
    private final long preAuthTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            @Value("${jwt.pre-auth-expiration:300000}") long preAuthTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.preAuthTokenTtlMillis = preAuthTokenTtlMillis;
        this.clock = clock;
    }

    public String createAccessToken(AccessTokenClaims claims, Duration ttl) {
        Instant now = clock.instant();
        JwtBuilder builder = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(claims.userId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .claim(CLAIM_SCOPE, claims.scope().getClaimValue());
        if (claims.username() != null) {
            builder.claim(CLAIM_USERNAME, claims.username());
        }
        if (claims.sessionId() != null) {
            builder.claim(CLAIM_SESSION_ID, claims.sessionId());
        }
        return builder.signWith(tokenProvider.getSecretKey(), SIG.HS256).compact();
    }

    public String issueAccessToken(UserAccount user, String sessionId) {
        return createAccessToken(AccessTokenClaims.access(user.getId(), user.getUsername(), sessionId),
                Duration.ofMillis(accessTokenTtlMillis));
    }

    public String createPreAuthToken(UUID userId) {
        return createAccessToken(AccessTokenClaims.preAuth(userId), Duration.ofMillis(preAuthTokenTtlMillis));
    }

    public TokenPair issueTokenPair(UserAccount user, String sessionId, String refreshToken) {
        OffsetDateTime issuedAt = OffsetDateTime.now(clock);
        String accessToken = issueAccessToken(user, sessionId);
        return new TokenPair(
                accessToken,
                TokenPair.DEFAULT_TOKEN_TYPE,
                accessTokenTtlMillis / 1000L,
                refreshToken,
                refreshTokenTtlMillis / 1000L,
                issuedAt
        );
    }

    /**
     * Verifies signature, expiry and scope. Anything short of a fully valid token of the expected
     * scope is rejected.
     */
    public ParsedToken parse(String token, TokenScope expectedScope) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Missing token");
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token", e);
        }

        TokenScope scope;
        UUID userId;
        try {
            scope = TokenScope.fromClaim(claims.get(CLAIM_SCOPE, String.class));
            if (claims.getSubject() == null) {
                throw new IllegalArgumentException("Token has no subject");
            }
            userId = UUID.fromString(claims.getSubject());
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token", e);
        }
        if (scope != expectedScope) {
            throw new InvalidTokenException("Token scope not accepted here");
        }

        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
        Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;
        return new ParsedToken(
                userId,
                claims.get(CLAIM_USERNAME, String.class),
                claims.get(CLAIM_SESSION_ID, String.class),
                scope,
                OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                OffsetDateTime.ofInstant(expiresAt, clock.getZone())
        );
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    public long getRefreshTokenTtlMillis() {
        return refreshTokenTtlMillis;
    }

    public long getPreAuthTokenTtlMillis() {
        return preAuthTokenTtlMillis;
    }

    public record ParsedToken(
            UUID userId,
            String username,
            String sessionId,
            TokenScope scope,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
    }
}
