package com.soulsense.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.soulsense.backend.modules.auth.domain.UserAccount;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    @Query("select ua from UserAccount ua where lower(ua.username) = lower(:username)")
    Optional<UserAccount> findByUsernameIgnoreCase(@Param("username") String username);

    @Query("""
            select case when count(ua) > 0 then true else false end
              from UserAccount ua
             where lower(ua.username) = lower(:username)
            """)
    boolean existsByUsernameIgnoreCase(@Param("username") String username);

    @Query("""
            select ua
              from UserAccount ua, PersonalProfile pp
             where pp.userId = ua.id
               and lower(pp.email) = lower(:email)
            """)
    Optional<UserAccount> findByProfileEmail(@Param("email") String email);
}
