package com.soulsense.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.soulsense.backend.global.error.ProblemException;
import com.soulsense.backend.modules.auth.domain.CredentialStore;
import com.soulsense.backend.modules.auth.domain.OneTimeCode;
import com.soulsense.backend.modules.auth.domain.OtpType;
import com.soulsense.backend.modules.auth.domain.OtpVerification;
import com.soulsense.backend.modules.ratelimit.application.RateLimitFamily;
import com.soulsense.backend.modules.ratelimit.application.RateLimiterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and verifies numeric one-time codes. Only SHA-256 digests are stored.
 *
 * <p>Issuing a code supersedes every unused code of the same type for the user. A code found
 * expired on verification is consumed so it cannot be guessed again.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class OtpService {

    private static final Logger log = LoggerFactory.getLogger(OtpService.class);

    private final CredentialStore credentialStore;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final Clock clock;
    private final Duration ttl;
    private final int codeLength;

    public OtpService(
            CredentialStore credentialStore,
            RateLimiterRegistry rateLimiterRegistry,
            Clock clock,
            @Value("${soulsense.otp.ttl:PT5M}") Duration ttl,
            @Value("${soulsense.otp.length:6}") int codeLength
    ) {
        this.credentialStore = credentialStore;
        this.rateLimiterRegistry = rateLimiterRegistry;
        this.clock = clock;
        this.ttl = ttl;
        this.codeLength = codeLength;
    }

    /**
     * @return the plaintext code, to be handed to delivery and then forgotten
     * @throws com.soulsense.backend.modules.ratelimit.application.RateLimitedException when a code of
     *         this type was issued to the user inside the issuance window
     */
    public String issue(UUID userId, OtpType type) {
        rateLimiterRegistry.consume(RateLimitFamily.OTP_ISSUE, userId + ":" + type.name());

        OffsetDateTime now = OffsetDateTime.now(clock);
        int superseded = credentialStore.supersedeUnusedCodes(userId, type, now);
        if (superseded > 0) {
            log.debug("Superseded {} unused {} codes for userId={}", superseded, type, userId);
        }

        String code = SecureTokens.numericCode(codeLength);
        credentialStore.saveOneTimeCode(
                new OneTimeCode(userId, SecureTokens.sha256Hex(code), type, now, now.plus(ttl)));
        return code;
    }

    public OtpVerification verify(UUID userId, OtpType type, String candidate) {
        Optional<OneTimeCode> latest = credentialStore.findLatestUnusedCode(userId, type);
        if (latest.isEmpty()) {
            return OtpVerification.NOT_FOUND;
        }
        OneTimeCode code = latest.get();
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (code.isExpiredAt(now)) {
            credentialStore.consumeCode(code.getId(), now);
            return OtpVerification.EXPIRED;
        }

        if (candidate == null || candidate.isBlank()
                || !SecureTokens.digestsMatch(code.getCodeHash(), SecureTokens.sha256Hex(candidate.trim()))) {
            return OtpVerification.MISMATCH;
        }

        // lost a race against another verification of the same code
        if (!credentialStore.consumeCode(code.getId(), now)) {
            return OtpVerification.NOT_FOUND;
        }
        return OtpVerification.VERIFIED;
    }

    public Duration getTtl() {
        return ttl;
    }
}
