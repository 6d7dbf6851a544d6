package com.soulsense.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.UUID;

import com.soulsense.backend.modules.auth.domain.SessionValidation;
import com.soulsense.backend.modules.auth.domain.UserSession;
import com.soulsense.backend.support.InMemoryCredentialStore;
import com.soulsense.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SessionServiceTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000501");

    private MutableClock clock;
    private InMemoryCredentialStore store;
    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T09:00:00Z");
        store = new InMemoryCredentialStore();
        sessionService = new SessionService(store, clock);
    }

    @Test
    void userMayHoldSeveralActiveSessions() {
        String first = sessionService.create(USER_ID, "alice", "10.0.0.1", "firefox");
        String second = sessionService.create(USER_ID, "alice", "10.0.0.2", "curl");

        assertThat(first).isNotEqualTo(second);
        assertThat(sessionService.listActive("alice"))
                .extracting(UserSession::getSessionId)
                .containsExactly(first, second);
    }

    @Test
    void oversizedClientAddressIsCutToTheColumnWidth() {
        String sid = sessionService.create(USER_ID, "alice", "x".repeat(100), "firefox");

        assertThat(store.findSession(sid).orElseThrow().getIpAddress())
                .hasSize(UserSession.MAX_IP_ADDRESS_LENGTH)
                .isEqualTo("x".repeat(UserSession.MAX_IP_ADDRESS_LENGTH));
    }

    @Test
    void validateReturnsOwnerAndBumpsLastAccess() {
        String sid = sessionService.create(USER_ID, "alice", null, null);
        clock.advance(Duration.ofMinutes(10));

        SessionValidation validation = sessionService.validate(sid);

        assertThat(validation.valid()).isTrue();
        assertThat(validation.username()).isEqualTo("alice");
        assertThat(validation.userId()).isEqualTo(USER_ID);
        assertThat(store.findSession(sid).orElseThrow().getLastAccessedAt()).isEqualTo(clock.now());
    }

    @Test
    void invalidateDeactivatesSession() {
        String sid = sessionService.create(USER_ID, "alice", null, null);

        assertThat(sessionService.invalidate(sid)).isTrue();
        assertThat(sessionService.invalidate(sid)).isFalse();

        UserSession session = store.findSession(sid).orElseThrow();
        assertThat(session.isActive()).isFalse();
        assertThat(session.getLoggedOutAt()).isEqualTo(clock.now());
        assertThat(sessionService.validate(sid).valid()).isFalse();
    }

    @Test
    void unknownOrBlankSessionIsInvalid() {
        assertThat(sessionService.validate("missing").valid()).isFalse();
        assertThat(sessionService.validate("").valid()).isFalse();
        assertThat(sessionService.validate(null).valid()).isFalse();
        assertThat(sessionService.invalidate(null)).isFalse();
    }

    @Test
    void invalidateAllReportsHowManySessionsEnded() {
        sessionService.create(USER_ID, "alice", null, null);
        sessionService.create(USER_ID, "alice", null, null);
        sessionService.create(UUID.randomUUID(), "bob", null, null);

        assertThat(sessionService.invalidateAll("ALICE")).isEqualTo(2);
        assertThat(sessionService.listActive("alice")).isEmpty();
        assertThat(sessionService.listActive("bob")).hasSize(1);
    }

    @Test
    @DisplayName("cleanup ends sessions by age since creation")
    void cleanupStaleDeactivatesOldSessionsOnly() {
        String old = sessionService.create(USER_ID, "alice", null, null);
        clock.advance(Duration.ofHours(24));
        String recent = sessionService.create(USER_ID, "alice", null, null);
        clock.advance(Duration.ofHours(1));
        // recently used sessions still age out
        sessionService.validate(old);

        int cleaned = sessionService.cleanupStale(24);

        assertThat(cleaned).isEqualTo(1);
        assertThat(sessionService.validate(old).valid()).isFalse();
        assertThat(sessionService.validate(recent).valid()).isTrue();
    }

    @Test
    void cleanupRequiresPositiveAge() {
        assertThatThrownBy(() -> sessionService.cleanupStale(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void longUserAgentIsTruncated() {
        String sid = sessionService.create(USER_ID, "alice", null, "b".repeat(400));

        assertThat(store.findSession(sid).orElseThrow().getUserAgent()).hasSize(255);
    }
}
