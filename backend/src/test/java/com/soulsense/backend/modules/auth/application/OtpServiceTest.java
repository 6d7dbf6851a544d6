package com.soulsense.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.UUID;

import com.soulsense.backend.modules.auth.domain.OneTimeCode;
import com.soulsense.backend.modules.auth.domain.OtpType;
import com.soulsense.backend.modules.auth.domain.OtpVerification;
import com.soulsense.backend.modules.ratelimit.application.RateLimitedException;
import com.soulsense.backend.modules.ratelimit.application.RateLimiterRegistry;
import com.soulsense.backend.modules.ratelimit.config.RateLimitProperties;
import com.soulsense.backend.support.InMemoryCredentialStore;
import com.soulsense.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OtpServiceTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000201");

    private MutableClock clock;
    private InMemoryCredentialStore store;
    private OtpService otpService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T09:00:00Z");
        store = new InMemoryCredentialStore();
        RateLimiterRegistry registry = new RateLimiterRegistry(new RateLimitProperties(), clock);
        otpService = new OtpService(store, registry, clock, Duration.ofMinutes(5), 6);
    }

    @Test
    void issuedCodeIsSixDigitsAndStoredOnlyAsHash() {
        String code = otpService.issue(USER_ID, OtpType.RESET_PASSWORD);

        assertThat(code).matches("\\d{6}");
        OneTimeCode stored = store.codesFor(USER_ID, OtpType.RESET_PASSWORD).get(0);
        assertThat(stored.getCodeHash()).isNotEqualTo(code).isEqualTo(SecureTokens.sha256Hex(code));
        assertThat(stored.getExpiresAt()).isEqualTo(clock.now().plusMinutes(5));
    }

    @Test
    @DisplayName("a code verifies exactly once")
    void codeIsSingleUse() {
        String code = otpService.issue(USER_ID, OtpType.LOGIN_2FA);

        assertThat(otpService.verify(USER_ID, OtpType.LOGIN_2FA, code)).isEqualTo(OtpVerification.VERIFIED);
        assertThat(otpService.verify(USER_ID, OtpType.LOGIN_2FA, code)).isEqualTo(OtpVerification.NOT_FOUND);
    }

    @Test
    void codeIsBoundToItsType() {
        String code = otpService.issue(USER_ID, OtpType.SETUP_2FA);

        assertThat(otpService.verify(USER_ID, OtpType.LOGIN_2FA, code)).isEqualTo(OtpVerification.NOT_FOUND);
        assertThat(otpService.verify(USER_ID, OtpType.SETUP_2FA, code)).isEqualTo(OtpVerification.VERIFIED);
    }

    @Test
    void expiredCodeIsRejectedAndConsumed() {
        String code = otpService.issue(USER_ID, OtpType.RESET_PASSWORD);
        clock.advance(Duration.ofMinutes(6));

        assertThat(otpService.verify(USER_ID, OtpType.RESET_PASSWORD, code)).isEqualTo(OtpVerification.EXPIRED);
        assertThat(store.codesFor(USER_ID, OtpType.RESET_PASSWORD)).allMatch(OneTimeCode::isUsed);
        assertThat(otpService.verify(USER_ID, OtpType.RESET_PASSWORD, code)).isEqualTo(OtpVerification.NOT_FOUND);
    }

    @Test
    void mismatchLeavesCodeUsable() {
        String code = otpService.issue(USER_ID, OtpType.RESET_PASSWORD);
        String wrong = code.equals("000000") ? "111111" : "000000";

        assertThat(otpService.verify(USER_ID, OtpType.RESET_PASSWORD, wrong)).isEqualTo(OtpVerification.MISMATCH);
        assertThat(otpService.verify(USER_ID, OtpType.RESET_PASSWORD, " ")).isEqualTo(OtpVerification.MISMATCH);
        assertThat(otpService.verify(USER_ID, OtpType.RESET_PASSWORD, code)).isEqualTo(OtpVerification.VERIFIED);
    }

    @Test
    void newCodeSupersedesOlderOne() {
        String first = otpService.issue(USER_ID, OtpType.RESET_PASSWORD);
        clock.advance(Duration.ofSeconds(61));
        String second = otpService.issue(USER_ID, OtpType.RESET_PASSWORD);

        if (!first.equals(second)) {
            assertThat(otpService.verify(USER_ID, OtpType.RESET_PASSWORD, first))
                    .isEqualTo(OtpVerification.MISMATCH);
        }
        assertThat(otpService.verify(USER_ID, OtpType.RESET_PASSWORD, second)).isEqualTo(OtpVerification.VERIFIED);
        assertThat(store.codesFor(USER_ID, OtpType.RESET_PASSWORD)).hasSize(2).allMatch(OneTimeCode::isUsed);
    }

    @Test
    void secondIssueInsideWindowIsRateLimited() {
        otpService.issue(USER_ID, OtpType.RESET_PASSWORD);

        assertThatThrownBy(() -> otpService.issue(USER_ID, OtpType.RESET_PASSWORD))
                .isInstanceOf(RateLimitedException.class);
        // other types keep their own budget
        assertThat(otpService.issue(USER_ID, OtpType.LOGIN_2FA)).matches("\\d{6}");
    }
}
