package com.soulsense.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.soulsense.backend.modules.auth.domain.PersonalProfile;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PersonalProfileRepository extends JpaRepository<PersonalProfile, UUID> {

    Optional<PersonalProfile> findByUserId(UUID userId);

    @Query("""
            select case when count(pp) > 0 then true else false end
              from PersonalProfile pp
             where lower(pp.email) = lower(:email)
            """)
    boolean existsByEmailIgnoreCase(@Param("email") String email);
}
