package com.soulsense.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.soulsense.backend.global.error.ProblemException;
import com.soulsense.backend.modules.auth.domain.CredentialStore;
import com.soulsense.backend.modules.auth.domain.LoginAttempt;
import com.soulsense.backend.modules.auth.domain.OneTimeCode;
import com.soulsense.backend.modules.auth.domain.OtpType;
import com.soulsense.backend.modules.auth.domain.PersonalProfile;
import com.soulsense.backend.modules.auth.domain.RefreshToken;
import com.soulsense.backend.modules.auth.domain.UserAccount;
import com.soulsense.backend.modules.auth.domain.UserAccountUpdate;
import com.soulsense.backend.modules.auth.domain.UserSession;

import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@Transactional(noRollbackFor = ProblemException.class)
public class JpaCredentialStore implements CredentialStore {

    private final UserAccountRepository userAccountRepository;
    private final PersonalProfileRepository personalProfileRepository;
    private final OneTimeCodeRepository oneTimeCodeRepository;
    private final RefreshTokenRepository refreshTokenRepository;
    private final LoginAttemptRepository loginAttemptRepository;
    private final UserSessionRepository userSessionRepository;

    public JpaCredentialStore(
            UserAccountRepository userAccountRepository,
            PersonalProfileRepository personalProfileRepository,
            OneTimeCodeRepository oneTimeCodeRepository,
            RefreshTokenRepository refreshTokenRepository,
            LoginAttemptRepository loginAttemptRepository,
            UserSessionRepository userSessionRepository
    ) {
        this.userAccountRepository = userAccountRepository;
        this.personalProfileRepository = personalProfileRepository;
        this.oneTimeCodeRepository = oneTimeCodeRepository;
        this.refreshTokenRepository = refreshTokenRepository;
        this.loginAttemptRepository = loginAttemptRepository;
        this.userSessionRepository = userSessionRepository;
    }

    @Override
    public UserAccount saveNewUser(UserAccount user) {
        return userAccountRepository.saveAndFlush(user);
    }

    @Override
    public Optional<UserAccount> findUserById(UUID userId) {
        return userAccountRepository.findById(userId);
    }

    @Override
    public Optional<UserAccount> findUserByUsername(String username) {
        return userAccountRepository.findByUsernameIgnoreCase(username);
    }

    @Override
    public Optional<UserAccount> findUserByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return userAccountRepository.findByProfileEmail(email);
    }

    @Override
    public boolean usernameExists(String username) {
        return userAccountRepository.existsByUsernameIgnoreCase(username);
    }

    @Override
    public boolean emailExists(String email) {
        return personalProfileRepository.existsByEmailIgnoreCase(email);
    }

    @Override
    public UserAccount updateUser(UUID userId, UserAccountUpdate update, OffsetDateTime now) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(ProblemException::userNotFound);
        user.apply(update, now);
        return userAccountRepository.save(user);
    }

    @Override
    public PersonalProfile saveProfile(PersonalProfile profile) {
        return personalProfileRepository.saveAndFlush(profile);
    }

    @Override
    public Optional<PersonalProfile> findProfileByUserId(UUID userId) {
        return personalProfileRepository.findByUserId(userId);
    }

    @Override
    public OneTimeCode saveOneTimeCode(OneTimeCode code) {
        return oneTimeCodeRepository.save(code);
    }

    @Override
    public Optional<OneTimeCode> findLatestUnusedCode(UUID userId, OtpType type) {
        return oneTimeCodeRepository.findFirstByUserIdAndTypeAndUsedFalseOrderByCreatedAtDesc(userId, type);
    }

    @Override
    public int supersedeUnusedCodes(UUID userId, OtpType type, OffsetDateTime at) {
        return oneTimeCodeRepository.markUnusedAsUsed(userId, type, at);
    }

    @Override
    public boolean consumeCode(UUID codeId, OffsetDateTime at) {
        return oneTimeCodeRepository.consume(codeId, at) == 1;
    }

    @Override
    public RefreshToken saveRefreshToken(RefreshToken token) {
        return refreshTokenRepository.save(token);
    }

    @Override
    public Optional<RefreshToken> findRefreshTokenByHash(String tokenHash) {
        return refreshTokenRepository.findByTokenHash(tokenHash);
    }

    @Override
    public boolean revokeRefreshToken(String tokenHash, OffsetDateTime at, String reason) {
        return refreshTokenRepository.revokeByTokenHash(tokenHash, at, reason) == 1;
    }

    @Override
    public int revokeRefreshTokensForSession(String sessionId, OffsetDateTime at, String reason) {
        return refreshTokenRepository.revokeBySessionId(sessionId, at, reason);
    }

    @Override
    public int revokeRefreshTokensForUser(UUID userId, OffsetDateTime at, String reason) {
        return refreshTokenRepository.revokeByUserId(userId, at, reason);
    }

    @Override
    public LoginAttempt recordLoginAttempt(LoginAttempt attempt) {
        return loginAttemptRepository.save(attempt);
    }

    @Override
    public List<LoginAttempt> findLoginAttempts(String identifier) {
        return loginAttemptRepository.findByIdentifierOrderByAttemptedAtAsc(identifier);
    }

    @Override
    public UserSession saveSession(UserSession session) {
        return userSessionRepository.save(session);
    }

    @Override
    public Optional<UserSession> findSession(String sessionId) {
        return userSessionRepository.findBySessionId(sessionId);
    }

    @Override
    public boolean touchSession(String sessionId, OffsetDateTime at) {
        return userSessionRepository.touch(sessionId, at) == 1;
    }

    @Override
    public boolean deactivateSession(String sessionId, OffsetDateTime at) {
        return userSessionRepository.deactivate(sessionId, at) == 1;
    }

    @Override
    public int deactivateSessionsForUser(String username, OffsetDateTime at) {
        return userSessionRepository.deactivateAllForUsername(username, at);
    }

    @Override
    public List<UserSession> findActiveSessions(String username) {
        return userSessionRepository.findActiveByUsername(username);
    }

    @Override
    public int deactivateSessionsCreatedBefore(OffsetDateTime cutoff, OffsetDateTime at) {
        return userSessionRepository.deactivateCreatedBefore(cutoff, at);
    }
}
