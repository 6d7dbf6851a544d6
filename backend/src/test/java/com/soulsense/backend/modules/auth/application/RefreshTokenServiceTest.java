package com.soulsense.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.UUID;

import com.soulsense.backend.modules.auth.domain.InvalidTokenException;
import com.soulsense.backend.modules.auth.domain.RefreshToken;
import com.soulsense.backend.support.InMemoryCredentialStore;
import com.soulsense.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RefreshTokenServiceTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000401");

    private MutableClock clock;
    private InMemoryCredentialStore store;
    private RefreshTokenService refreshTokenService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T09:00:00Z");
        store = new InMemoryCredentialStore();
        refreshTokenService = new RefreshTokenService(store, clock, Duration.ofDays(7).toMillis());
    }

    @Test
    void redeemRotatesTokenWithinSession() {
        String original = refreshTokenService.issue(USER_ID, "sid-1");

        RefreshRedemption redemption = refreshTokenService.redeem(original);

        assertThat(redemption.userId()).isEqualTo(USER_ID);
        assertThat(redemption.sessionId()).isEqualTo("sid-1");
        assertThat(redemption.newRefreshToken()).isNotEqualTo(original);
        RefreshToken stored = store.findRefreshTokenByHash(SecureTokens.sha256Hex(original)).orElseThrow();
        assertThat(stored.getRevokedReason()).isEqualTo(RefreshTokenService.REASON_ROTATED);
    }

    @Test
    void tokenRedeemsAtMostOnce() {
        String original = refreshTokenService.issue(USER_ID, "sid-1");
        refreshTokenService.redeem(original);

        assertThatThrownBy(() -> refreshTokenService.redeem(original))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void successorCanBeRedeemed() {
        String first = refreshTokenService.issue(USER_ID, "sid-1");
        String second = refreshTokenService.redeem(first).newRefreshToken();

        assertThat(refreshTokenService.redeem(second).sessionId()).isEqualTo("sid-1");
    }

    @Test
    void expiredTokenIsRevokedAndRejected() {
        String token = refreshTokenService.issue(USER_ID, "sid-1");
        clock.advance(Duration.ofDays(7).plusSeconds(1));

        assertThatThrownBy(() -> refreshTokenService.redeem(token))
                .isInstanceOf(InvalidTokenException.class);
        RefreshToken stored = store.findRefreshTokenByHash(SecureTokens.sha256Hex(token)).orElseThrow();
        assertThat(stored.getRevokedReason()).isEqualTo(RefreshTokenService.REASON_EXPIRED);
    }

    @Test
    void unknownOrBlankTokenIsRejected() {
        assertThatThrownBy(() -> refreshTokenService.redeem("unknown"))
                .isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> refreshTokenService.redeem(""))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void revokeIsIdempotent() {
        String token = refreshTokenService.issue(USER_ID, "sid-1");

        assertThat(refreshTokenService.revoke(token, RefreshTokenService.REASON_LOGOUT)).isTrue();
        assertThat(refreshTokenService.revoke(token, RefreshTokenService.REASON_LOGOUT)).isFalse();
        assertThat(refreshTokenService.revoke("unknown", RefreshTokenService.REASON_LOGOUT)).isFalse();
        assertThatThrownBy(() -> refreshTokenService.redeem(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void revokeForSessionLeavesOtherSessionsAlone() {
        String a = refreshTokenService.issue(USER_ID, "sid-a");
        String b = refreshTokenService.issue(USER_ID, "sid-b");

        assertThat(refreshTokenService.revokeForSession("sid-a", RefreshTokenService.REASON_LOGOUT)).isEqualTo(1);

        assertThatThrownBy(() -> refreshTokenService.redeem(a)).isInstanceOf(InvalidTokenException.class);
        assertThat(refreshTokenService.redeem(b).sessionId()).isEqualTo("sid-b");
    }

    @Test
    void revokeAllForUserCountsOnlyLiveTokens() {
        refreshTokenService.issue(USER_ID, "sid-a");
        String rotated = refreshTokenService.issue(USER_ID, "sid-b");
        refreshTokenService.redeem(rotated);

        // sid-a original plus the sid-b successor
        assertThat(refreshTokenService.revokeAllForUser(USER_ID, RefreshTokenService.REASON_PASSWORD_RESET))
                .isEqualTo(2);
        assertThat(store.refreshTokensFor(USER_ID)).allMatch(token -> token.getRevokedAt() != null);
    }
}
