package com.soulsense.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.soulsense.backend.modules.auth.domain.LoginAttempt;

import org.springframework.data.jpa.repository.JpaRepository;

public interface LoginAttemptRepository extends JpaRepository<LoginAttempt, UUID> {

    List<LoginAttempt> findByIdentifierOrderByAttemptedAtAsc(String identifier);
}
