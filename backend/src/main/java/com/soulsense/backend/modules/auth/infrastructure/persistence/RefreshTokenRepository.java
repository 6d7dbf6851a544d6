package com.soulsense.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.soulsense.backend.modules.auth.domain.RefreshToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update RefreshToken rt
               set rt.revokedAt = :revokedAt,
                   rt.revokedReason = :reason
             where rt.tokenHash = :tokenHash
               and rt.revokedAt is null
            """)
    int revokeByTokenHash(@Param("tokenHash") String tokenHash,
                          @Param("revokedAt") OffsetDateTime revokedAt,
                          @Param("reason") String reason);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update RefreshToken rt
               set rt.revokedAt = :revokedAt,
                   rt.revokedReason = :reason
             where rt.sessionId = :sessionId
               and rt.revokedAt is null
            """)
    int revokeBySessionId(@Param("sessionId") String sessionId,
                          @Param("revokedAt") OffsetDateTime revokedAt,
                          @Param("reason") String reason);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update RefreshToken rt
               set rt.revokedAt = :revokedAt,
                   rt.revokedReason = :reason
             where rt.userId = :userId
               and rt.revokedAt is null
            """)
    int revokeByUserId(@Param("userId") UUID userId,
                       @Param("revokedAt") OffsetDateTime revokedAt,
                       @Param("reason") String reason);
}
