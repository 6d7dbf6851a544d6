package com.soulsense.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.soulsense.backend.modules.audit.application.AuditDetailsSanitizer;
import com.soulsense.backend.modules.auth.domain.CredentialStore;
import com.soulsense.backend.modules.auth.domain.SessionValidation;
import com.soulsense.backend.modules.auth.domain.UserSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Named login sessions. A user may hold any number of active sessions; sessions are deactivated,
 * never deleted.
 */
@Service
@Transactional
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private static final int MAX_USER_AGENT_LENGTH = 255;

    private final CredentialStore credentialStore;
    private final Clock clock;

    public SessionService(CredentialStore credentialStore, Clock clock) {
        this.credentialStore = credentialStore;
        this.clock = clock;
    }

    public String create(UUID userId, String username, String ipAddress, String userAgent) {
        String sessionId = SecureTokens.newToken();
        credentialStore.saveSession(new UserSession(
                sessionId,
                userId,
                username,
                ipAddress,
                AuditDetailsSanitizer.truncate(userAgent, MAX_USER_AGENT_LENGTH),
                OffsetDateTime.now(clock)
        ));
        return sessionId;
    }

    /**
     * Valid only while the session exists and is active; a valid lookup bumps last-accessed.
     */
    public SessionValidation validate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return SessionValidation.invalid();
        }
        Optional<UserSession> session = credentialStore.findSession(sessionId);
        if (session.isEmpty() || !session.get().isActive()) {
            return SessionValidation.invalid();
        }
        if (!credentialStore.touchSession(sessionId, OffsetDateTime.now(clock))) {
            return SessionValidation.invalid();
        }
        return SessionValidation.valid(session.get());
    }

    @Transactional(readOnly = true)
    public Optional<UserSession> find(String sessionId) {
        return credentialStore.findSession(sessionId);
    }

    /** Idempotent; returns whether this call deactivated the session. */
    public boolean invalidate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return false;
        }
        return credentialStore.deactivateSession(sessionId, OffsetDateTime.now(clock));
    }

    public int invalidateAll(String username) {
        return credentialStore.deactivateSessionsForUser(username, OffsetDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public List<UserSession> listActive(String username) {
        return credentialStore.findActiveSessions(username);
    }

    /**
     * Deactivates every active session created more than {@code maxAgeHours} ago. Age is measured
     * from creation, not from last access.
     */
    public int cleanupStale(int maxAgeHours) {
        if (maxAgeHours <= 0) {
            throw new IllegalArgumentException("maxAgeHours must be positive");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        int cleaned = credentialStore.deactivateSessionsCreatedBefore(now.minusHours(maxAgeHours), now);
        if (cleaned > 0) {
            log.info("Deactivated {} sessions older than {}h", cleaned, maxAgeHours);
        }
        return cleaned;
    }
}
