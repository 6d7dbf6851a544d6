package com.soulsense.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.soulsense.backend.global.error.ProblemException;
import com.soulsense.backend.modules.audit.application.AuditLogService;
import com.soulsense.backend.modules.audit.domain.AuditAction;
import com.soulsense.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.soulsense.backend.modules.auth.domain.AuthErrorCode;
import com.soulsense.backend.modules.auth.domain.AuthException;
import com.soulsense.backend.modules.auth.domain.AuthState;
import com.soulsense.backend.modules.auth.domain.CredentialStore;
import com.soulsense.backend.modules.auth.domain.InvalidTokenException;
import com.soulsense.backend.modules.auth.domain.LoginAttempt;
import com.soulsense.backend.modules.auth.domain.LoginResult;
import com.soulsense.backend.modules.auth.domain.OtpType;
import com.soulsense.backend.modules.auth.domain.OtpVerification;
import com.soulsense.backend.modules.auth.domain.PersonalProfile;
import com.soulsense.backend.modules.auth.domain.RegistrationFields;
import com.soulsense.backend.modules.auth.domain.SessionValidation;
import com.soulsense.backend.modules.auth.domain.TokenPair;
import com.soulsense.backend.modules.auth.domain.TokenScope;
import com.soulsense.backend.modules.auth.domain.UserAccount;
import com.soulsense.backend.modules.auth.domain.UserAccountUpdate;
import com.soulsense.backend.modules.auth.domain.UserSession;
import com.soulsense.backend.modules.ratelimit.application.RateLimitDecision;
import com.soulsense.backend.modules.ratelimit.application.RateLimitFamily;
import com.soulsense.backend.modules.ratelimit.application.RateLimitedException;
import com.soulsense.backend.modules.ratelimit.application.RateLimiterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Registration, login (with optional second factor), token refresh, logout and password reset.
 *
 * <p>Every flow consults the rate limiter first, then the credential store, then the OTP, token
 * and session services, and appends its audit entry last. Failure-path writes (login attempts,
 * consumed expired codes, revoked tokens) commit together with the caller's transaction.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String UNKNOWN_CLIENT = "unknown";
    private static final String RESET_ISSUE_KEY_PREFIX = "reset:";
    private static final String OUTCOME = "outcome";
    private static final String REASON = "reason";

    private final CredentialStore credentialStore;
    private final PasswordEncoder passwordEncoder;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final OtpService otpService;
    private final OtpDeliveryGateway otpDeliveryGateway;
    private final JwtTokenService jwtTokenService;
    private final RefreshTokenService refreshTokenService;
    private final SessionService sessionService;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final String dummyPasswordHash;

    public AuthService(
            CredentialStore credentialStore,
            PasswordEncoder passwordEncoder,
            RateLimiterRegistry rateLimiterRegistry,
            OtpService otpService,
            OtpDeliveryGateway otpDeliveryGateway,
            JwtTokenService jwtTokenService,
            RefreshTokenService refreshTokenService,
            SessionService sessionService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.credentialStore = credentialStore;
        this.passwordEncoder = passwordEncoder;
        this.rateLimiterRegistry = rateLimiterRegistry;
        this.otpService = otpService;
        this.otpDeliveryGateway = otpDeliveryGateway;
        this.jwtTokenService = jwtTokenService;
        this.refreshTokenService = refreshTokenService;
        this.sessionService = sessionService;
        this.auditLogService = auditLogService;
        this.clock = clock;
        // compared against when the identifier is unknown so both paths pay for one hash check
        this.dummyPasswordHash = passwordEncoder.encode(SecureTokens.newToken());
    }

    // registration

    /**
     * @throws AuthException {@code VALIDATION}, {@code USERNAME_TAKEN} or {@code EMAIL_TAKEN}
     * @throws RateLimitedException when the client registered too often
     */
    @Transactional
    public UserAccount register(RegistrationFields fields, String ipAddress, String userAgent) {
        rateLimiterRegistry.consume(RateLimitFamily.REGISTRATION, clientKey(ipAddress));
        CredentialPolicy.validateRegistration(fields);

        String username = fields.username().trim();
        String email = CredentialPolicy.normalizeEmail(fields.email());
        if (credentialStore.usernameExists(username)) {
            throw new AuthException(AuthErrorCode.USERNAME_TAKEN);
        }
        if (credentialStore.emailExists(email)) {
            throw new AuthException(AuthErrorCode.EMAIL_TAKEN);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        UserAccount user;
        try {
            user = credentialStore.saveNewUser(
                    new UserAccount(username, passwordEncoder.encode(fields.password()), now));
            PersonalProfile profile = new PersonalProfile(user.getId(), email, now);
            profile.setFirstName(fields.firstName());
            profile.setLastName(fields.lastName());
            profile.setAge(fields.age());
            profile.setGender(fields.gender());
            credentialStore.saveProfile(profile);
        } catch (DataIntegrityViolationException ex) {
            // a concurrent registration claimed the name or address first
            throw new AuthException(AuthErrorCode.USERNAME_TAKEN, "Username or email already registered", ex);
        }

        log.info("Registered userId={}", user.getId());
        auditLogService.log(user.getId(), AuditAction.REGISTER, ipAddress, userAgent, Map.of("username", username));
        return user;
    }

    @Transactional
    public UserAccount register(RegistrationFields fields) {
        return register(fields, null, null);
    }

    // login

    public LoginResult login(String identifier, String password, String ipAddress, String userAgent) {
        String normalized = identifier == null ? "" : identifier.trim();
        OffsetDateTime now = OffsetDateTime.now(clock);

        RateLimitDecision decision = rateLimiterRegistry.check(RateLimitFamily.LOGIN,
                normalized.toLowerCase(Locale.ROOT));
        if (decision.limited()) {
            recordFailedAttempt(normalized, LoginAttempt.REASON_RATE_LIMITED, ipAddress, userAgent, now);
            return LoginResult.rateLimited(decision.retryAfterSeconds());
        }

        Optional<UserAccount> found = lookupByIdentifier(normalized);
        String hash = found.map(UserAccount::getPasswordHash).orElse(dummyPasswordHash);
        boolean passwordMatches = password != null && passwordEncoder.matches(password, hash);
        if (found.isEmpty() || !passwordMatches) {
            recordFailedAttempt(normalized, LoginAttempt.REASON_INVALID_CREDENTIALS, ipAddress, userAgent, now);
            auditLoginFailure(found.map(UserAccount::getId).orElse(null), normalized,
                    LoginAttempt.REASON_INVALID_CREDENTIALS, ipAddress, userAgent);
            return LoginResult.failed(AuthState.INVALID_CREDENTIALS);
        }

        UserAccount user = found.get();
        if (!user.isActive()) {
            recordFailedAttempt(normalized, LoginAttempt.REASON_ACCOUNT_DEACTIVATED, ipAddress, userAgent, now);
            auditLoginFailure(user.getId(), normalized, LoginAttempt.REASON_ACCOUNT_DEACTIVATED, ipAddress, userAgent);
            return LoginResult.failed(AuthState.ACCOUNT_DEACTIVATED);
        }

        if (user.isTwoFactorEnabled()) {
            return beginSecondFactor(user, normalized, ipAddress, userAgent, now);
        }
        return completeAuthentication(user, normalized, "password", ipAddress, userAgent);
    }

    public LoginResult verify2fa(String preAuthToken, String code, String ipAddress, String userAgent) {
        ParsedToken parsed;
        try {
            parsed = jwtTokenService.parse(preAuthToken, TokenScope.PRE_AUTH);
        } catch (InvalidTokenException ex) {
            return LoginResult.failed(AuthState.INVALID_TOKEN);
        }

        Optional<UserAccount> found = credentialStore.findUserById(parsed.userId());
        if (found.isEmpty()) {
            return LoginResult.failed(AuthState.INVALID_TOKEN);
        }
        UserAccount user = found.get();
        OffsetDateTime now = OffsetDateTime.now(clock);

        RateLimitDecision decision = rateLimiterRegistry.check(RateLimitFamily.OTP_VERIFY, user.getId().toString());
        if (decision.limited()) {
            recordFailedAttempt(user.getUsername(), LoginAttempt.REASON_RATE_LIMITED, ipAddress, userAgent, now);
            return LoginResult.rateLimited(decision.retryAfterSeconds());
        }
        if (!user.isActive()) {
            recordFailedAttempt(user.getUsername(), LoginAttempt.REASON_ACCOUNT_DEACTIVATED, ipAddress, userAgent, now);
            auditLoginFailure(user.getId(), user.getUsername(), LoginAttempt.REASON_ACCOUNT_DEACTIVATED,
                    ipAddress, userAgent);
            return LoginResult.failed(AuthState.ACCOUNT_DEACTIVATED);
        }

        OtpVerification verification = otpService.verify(user.getId(), OtpType.LOGIN_2FA, code);
        if (verification.isVerified()) {
            return completeAuthentication(user, user.getUsername(), "2fa", ipAddress, userAgent);
        }

        AuthState failure = verification == OtpVerification.EXPIRED ? AuthState.OTP_EXPIRED : AuthState.OTP_MISMATCH;
        String reason = failure == AuthState.OTP_EXPIRED
                ? LoginAttempt.REASON_OTP_EXPIRED
                : LoginAttempt.REASON_OTP_MISMATCH;
        recordFailedAttempt(user.getUsername(), reason, ipAddress, userAgent, now);
        auditLoginFailure(user.getId(), user.getUsername(), reason, ipAddress, userAgent);
        return LoginResult.failed(failure);
    }

    public LoginResult verify2fa(String preAuthToken, String code) {
        return verify2fa(preAuthToken, code, null, null);
    }

    // tokens and sessions

    /**
     * Rotates the refresh token and issues a fresh access token for the same session.
     *
     * @throws InvalidTokenException when the token cannot be redeemed or its session or owner is no
     *         longer active
     */
    public TokenPair refreshAccessToken(String refreshToken) {
        RefreshRedemption redemption = refreshTokenService.redeem(refreshToken);

        UserAccount user = credentialStore.findUserById(redemption.userId())
                .filter(UserAccount::isActive)
                .orElse(null);
        if (user == null) {
            refreshTokenService.revoke(redemption.newRefreshToken(), RefreshTokenService.REASON_USER_INACTIVE);
            throw new InvalidTokenException("Invalid refresh token");
        }
        if (!sessionService.validate(redemption.sessionId()).valid()) {
            refreshTokenService.revoke(redemption.newRefreshToken(), RefreshTokenService.REASON_LOGOUT);
            throw new InvalidTokenException("Invalid refresh token");
        }
        return jwtTokenService.issueTokenPair(user, redemption.sessionId(), redemption.newRefreshToken());
    }

    public void logout(String sessionId, String ipAddress, String userAgent) {
        Optional<UserSession> session = sessionService.find(sessionId);
        boolean deactivated = sessionService.invalidate(sessionId);
        if (session.isEmpty()) {
            return;
        }
        refreshTokenService.revokeForSession(sessionId, RefreshTokenService.REASON_LOGOUT);
        if (deactivated) {
            auditLogService.log(session.get().getUserId(), AuditAction.LOGOUT, ipAddress, userAgent,
                    Map.of("scope", "session"));
        }
    }

    public void logout(String sessionId) {
        logout(sessionId, null, null);
    }

    /**
     * Deactivates every active session of the user and revokes all of their refresh tokens.
     *
     * @return number of sessions deactivated
     */
    public int logoutEverywhere(String username, String ipAddress, String userAgent) {
        Optional<UserAccount> user = credentialStore.findUserByUsername(username);
        int count = sessionService.invalidateAll(username);
        user.ifPresent(account -> {
            refreshTokenService.revokeAllForUser(account.getId(), RefreshTokenService.REASON_REVOKED);
            auditLogService.log(account.getId(), AuditAction.LOGOUT, ipAddress, userAgent,
                    Map.of("scope", "all", "sessions", count));
        });
        return count;
    }

    public int logoutEverywhere(String username) {
        return logoutEverywhere(username, null, null);
    }

    public SessionValidation validateSession(String sessionId) {
        return sessionService.validate(sessionId);
    }

    @Transactional(readOnly = true)
    public List<UserSession> listActiveSessions(String username) {
        return sessionService.listActive(username);
    }

    // password reset

    /**
     * Sends a reset code when the address belongs to an active account. Unknown addresses return
     * normally and are rate-limited exactly like known ones, so callers cannot tell which addresses have accounts.
     *
     * @throws RateLimitedException when resets for this address were requested too often
     */
    public void initiatePasswordReset(String email, String ipAddress) {
        String normalized = CredentialPolicy.normalizeEmail(email);
        if (normalized == null || normalized.isEmpty()) {
            throw new AuthException(AuthErrorCode.VALIDATION, "A valid email address is required");
        }
        rateLimiterRegistry.consume(RateLimitFamily.PASSWORD_RESET, normalized);
        // taken before the lookup so known and unknown addresses share one issuance window
        rateLimiterRegistry.consume(RateLimitFamily.OTP_ISSUE, RESET_ISSUE_KEY_PREFIX + normalized);

        Optional<UserAccount> user = credentialStore.findUserByEmail(normalized).filter(UserAccount::isActive);
        if (user.isEmpty()) {
            log.info("Password reset requested for unknown or inactive address from ip={}", ipAddress);
            return;
        }
        String code = otpService.issue(user.get().getId(), OtpType.RESET_PASSWORD);
        otpDeliveryGateway.deliver(user.get(), normalized, OtpType.RESET_PASSWORD, code);
    }

    public void initiatePasswordReset(String email) {
        initiatePasswordReset(email, null);
    }

    /**
     * @throws AuthException {@code OTP_EXPIRED} or {@code OTP_MISMATCH} with the password left
     *         unchanged, or {@code VALIDATION} when the new password violates the policy
     */
    public void completePasswordReset(String email, String code, String newPassword, String ipAddress,
                                      String userAgent) {
        CredentialPolicy.validatePassword(newPassword);
        UserAccount user = credentialStore.findUserByEmail(CredentialPolicy.normalizeEmail(email))
                .filter(UserAccount::isActive)
                .orElseThrow(() -> new AuthException(AuthErrorCode.OTP_MISMATCH));

        verifyOrThrow(user, OtpType.RESET_PASSWORD, code);

        OffsetDateTime now = OffsetDateTime.now(clock);
        credentialStore.updateUser(user.getId(), UserAccountUpdate.passwordHash(passwordEncoder.encode(newPassword)),
                now);
        int sessions = sessionService.invalidateAll(user.getUsername());
        refreshTokenService.revokeAllForUser(user.getId(), RefreshTokenService.REASON_PASSWORD_RESET);

        log.info("Password reset completed userId={}", user.getId());
        auditLogService.log(user.getId(), AuditAction.PASSWORD_RESET, ipAddress, userAgent,
                Map.of("sessions_revoked", sessions));
    }

    public void completePasswordReset(String email, String code, String newPassword) {
        completePasswordReset(email, code, newPassword, null, null);
    }

    // second factor management

    public void initiateTwoFactorSetup(UUID userId) {
        UserAccount user = requireActiveUser(userId);
        String email = credentialStore.findProfileByUserId(userId)
                .map(PersonalProfile::getEmail)
                .orElse(null);
        String code = otpService.issue(userId, OtpType.SETUP_2FA);
        otpDeliveryGateway.deliver(user, email, OtpType.SETUP_2FA, code);
    }

    public void enableTwoFactor(UUID userId, String code, String ipAddress, String userAgent) {
        UserAccount user = requireActiveUser(userId);
        verifyOrThrow(user, OtpType.SETUP_2FA, code);
        credentialStore.updateUser(userId, UserAccountUpdate.twoFactor(true), OffsetDateTime.now(clock));
        auditLogService.log(userId, AuditAction.TWO_FACTOR_ENABLED, ipAddress, userAgent, Map.of());
    }

    public void disableTwoFactor(UUID userId, String currentPassword, String ipAddress, String userAgent) {
        UserAccount user = requireActiveUser(userId);
        if (currentPassword == null || !passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }
        UserAccountUpdate update = UserAccountUpdate.builder()
                .twoFactorEnabled(false)
                .otpSecret("")
                .build();
        credentialStore.updateUser(userId, update, OffsetDateTime.now(clock));
        auditLogService.log(userId, AuditAction.TWO_FACTOR_DISABLED, ipAddress, userAgent, Map.of());
    }

    // administration

    /**
     * Deactivates the account (it is never deleted) and ends every session it holds.
     */
    public void deactivateUser(UUID userId, String ipAddress, String userAgent) {
        UserAccount user = credentialStore.findUserById(userId)
                .orElseThrow(ProblemException::userNotFound);
        if (!user.isActive()) {
            return;
        }
        credentialStore.updateUser(userId, UserAccountUpdate.deactivate(), OffsetDateTime.now(clock));
        int sessions = sessionService.invalidateAll(user.getUsername());
        refreshTokenService.revokeAllForUser(userId, RefreshTokenService.REASON_USER_INACTIVE);
        log.info("Deactivated userId={} sessions={}", userId, sessions);
        auditLogService.log(userId, AuditAction.ACCOUNT_DEACTIVATED, ipAddress, userAgent,
                Map.of("sessions_revoked", sessions));
    }

    private LoginResult beginSecondFactor(UserAccount user, String identifier, String ipAddress, String userAgent,
                                          OffsetDateTime now) {
        String code;
        try {
            code = otpService.issue(user.getId(), OtpType.LOGIN_2FA);
        } catch (RateLimitedException ex) {
            recordFailedAttempt(identifier, LoginAttempt.REASON_RATE_LIMITED, ipAddress, userAgent, now);
            return LoginResult.rateLimited(ex.getRetryAfterSeconds());
        }
        String email = credentialStore.findProfileByUserId(user.getId())
                .map(PersonalProfile::getEmail)
                .orElse(null);
        otpDeliveryGateway.deliver(user, email, OtpType.LOGIN_2FA, code);

        String preAuthToken = jwtTokenService.createPreAuthToken(user.getId());
        auditLogService.log(user.getId(), AuditAction.LOGIN_2FA_INITIATED, ipAddress, userAgent,
                Map.of("identifier", identifier));
        return LoginResult.preAuth(user, preAuthToken);
    }

    private LoginResult completeAuthentication(UserAccount user, String identifier, String method,
                                               String ipAddress, String userAgent) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String sessionId = sessionService.create(user.getId(), user.getUsername(), ipAddress, userAgent);
        String refreshToken = refreshTokenService.issue(user.getId(), sessionId);
        TokenPair tokens = jwtTokenService.issueTokenPair(user, sessionId, refreshToken);

        credentialStore.updateUser(user.getId(), UserAccountUpdate.lastLogin(now), now);
        credentialStore.recordLoginAttempt(LoginAttempt.success(identifier, ipAddress, userAgent, now));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put(OUTCOME, "success");
        details.put("method", method);
        auditLogService.log(user.getId(), AuditAction.LOGIN, ipAddress, userAgent, details);
        return LoginResult.authenticated(user, sessionId, tokens);
    }

    private void verifyOrThrow(UserAccount user, OtpType type, String code) {
        rateLimiterRegistry.consume(RateLimitFamily.OTP_VERIFY, user.getId().toString());
        OtpVerification verification = otpService.verify(user.getId(), type, code);
        switch (verification) {
            case VERIFIED -> {
            }
            case EXPIRED -> throw new AuthException(AuthErrorCode.OTP_EXPIRED);
            case MISMATCH, NOT_FOUND -> throw new AuthException(AuthErrorCode.OTP_MISMATCH);
        }
    }

    private Optional<UserAccount> lookupByIdentifier(String identifier) {
        if (identifier.isEmpty()) {
            return Optional.empty();
        }
        if (identifier.indexOf('@') >= 0) {
            return credentialStore.findUserByEmail(CredentialPolicy.normalizeEmail(identifier));
        }
        return credentialStore.findUserByUsername(identifier);
    }

    private UserAccount requireActiveUser(UUID userId) {
        UserAccount user = credentialStore.findUserById(userId)
                .orElseThrow(ProblemException::userNotFound);
        if (!user.isActive()) {
            throw new AuthException(AuthErrorCode.ACCOUNT_DEACTIVATED);
        }
        return user;
    }

    private void recordFailedAttempt(String identifier, String reason, String ipAddress, String userAgent,
                                     OffsetDateTime now) {
        credentialStore.recordLoginAttempt(LoginAttempt.failure(identifier, reason, ipAddress, userAgent, now));
    }

    private void auditLoginFailure(UUID userId, String identifier, String reason, String ipAddress,
                                   String userAgent) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(OUTCOME, "failure");
        details.put(REASON, reason);
        details.put("identifier", identifier);
        auditLogService.log(userId, AuditAction.LOGIN, ipAddress, userAgent, details);
    }

    private static String clientKey(String ipAddress) {
        return ipAddress == null || ipAddress.isBlank() ? UNKNOWN_CLIENT : ipAddress;
    }
}
