package com.soulsense.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.soulsense.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    Optional<UserSession> findBySessionId(String sessionId);

    @Query("""
            select us
              from UserSession us
             where lower(us.username) = lower(:username)
               and us.active = true
             order by us.createdAt asc
            """)
    List<UserSession> findActiveByUsername(@Param("username") String username);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.lastAccessedAt = :now
             where us.sessionId = :sessionId
               and us.active = true
            """)
    int touch(@Param("sessionId") String sessionId, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.active = false,
                   us.loggedOutAt = :loggedOutAt
             where us.sessionId = :sessionId
               and us.active = true
            """)
    int deactivate(@Param("sessionId") String sessionId, @Param("loggedOutAt") OffsetDateTime loggedOutAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.active = false,
                   us.loggedOutAt = :loggedOutAt
             where lower(us.username) = lower(:username)
               and us.active = true
            """)
    int deactivateAllForUsername(@Param("username") String username,
                                 @Param("loggedOutAt") OffsetDateTime loggedOutAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.active = false,
                   us.loggedOutAt = :loggedOutAt
             where us.createdAt < :cutoff
               and us.active = true
            """)
    int deactivateCreatedBefore(@Param("cutoff") OffsetDateTime cutoff,
                                @Param("loggedOutAt") OffsetDateTime loggedOutAt);
}
