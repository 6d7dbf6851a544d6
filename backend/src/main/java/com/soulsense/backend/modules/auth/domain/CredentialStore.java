package com.soulsense.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable state of the identity subsystem: accounts and profiles plus the one-time code,
 * refresh token, login attempt and session ledgers.
 *
 * <p>Ledger rows are only changed through the enumerated operations below. Conditional
 * operations report whether this call performed the change, so concurrent callers can tell who won.
 */
public interface CredentialStore {

    // accounts

    UserAccount saveNewUser(UserAccount user);

    Optional<UserAccount> findUserById(UUID userId);

    /** Case-insensitive. */
    Optional<UserAccount> findUserByUsername(String username);

    /** Case-insensitive, resolved through the personal profile. */
    Optional<UserAccount> findUserByEmail(String email);

    boolean usernameExists(String username);

    boolean emailExists(String email);

    UserAccount updateUser(UUID userId, UserAccountUpdate update, OffsetDateTime now);

    PersonalProfile saveProfile(PersonalProfile profile);

    Optional<PersonalProfile> findProfileByUserId(UUID userId);

    // one-time codes

    OneTimeCode saveOneTimeCode(OneTimeCode code);

    /** Most recently created unused code of the given type. */
    Optional<OneTimeCode> findLatestUnusedCode(UUID userId, OtpType type);

    /** Marks every unused code of the type as used; returns how many were superseded. */
    int supersedeUnusedCodes(UUID userId, OtpType type, OffsetDateTime at);

    /** Marks the code used if it still was unused. */
    boolean consumeCode(UUID codeId, OffsetDateTime at);

    // refresh tokens

    RefreshToken saveRefreshToken(RefreshToken token);

    Optional<RefreshToken> findRefreshTokenByHash(String tokenHash);

    /** Revokes the token if it was not revoked yet. */
    boolean revokeRefreshToken(String tokenHash, OffsetDateTime at, String reason);

    int revokeRefreshTokensForSession(String sessionId, OffsetDateTime at, String reason);

    int revokeRefreshTokensForUser(UUID userId, OffsetDateTime at, String reason);

    // login attempts

    LoginAttempt recordLoginAttempt(LoginAttempt attempt);

    List<LoginAttempt> findLoginAttempts(String identifier);

    // sessions

    UserSession saveSession(UserSession session);

    Optional<UserSession> findSession(String sessionId);

    /** Bumps last-accessed if the session is still active. */
    boolean touchSession(String sessionId, OffsetDateTime at);

    boolean deactivateSession(String sessionId, OffsetDateTime at);

    /** Case-insensitive on the username. */
    int deactivateSessionsForUser(String username, OffsetDateTime at);

    /** Case-insensitive on the username, oldest first. */
    List<UserSession> findActiveSessions(String username);

    int deactivateSessionsCreatedBefore(OffsetDateTime cutoff, OffsetDateTime at);
}
