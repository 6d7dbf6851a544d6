package com.soulsense.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.soulsense.backend.modules.auth.domain.OneTimeCode;
import com.soulsense.backend.modules.auth.domain.OtpType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OneTimeCodeRepository extends JpaRepository<OneTimeCode, UUID> {

    Optional<OneTimeCode> findFirstByUserIdAndTypeAndUsedFalseOrderByCreatedAtDesc(UUID userId, OtpType type);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update OneTimeCode otc
               set otc.used = true,
                   otc.usedAt = :usedAt
             where otc.userId = :userId
               and otc.type = :type
               and otc.used = false
            """)
    int markUnusedAsUsed(@Param("userId") UUID userId,
                         @Param("type") OtpType type,
                         @Param("usedAt") OffsetDateTime usedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update OneTimeCode otc
               set otc.used = true,
                   otc.usedAt = :usedAt
             where otc.id = :id
               and otc.used = false
            """)
    int consume(@Param("id") UUID id, @Param("usedAt") OffsetDateTime usedAt);
}
