package com.soulsense.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.soulsense.backend.modules.audit.domain.AuditLog;
import com.soulsense.backend.modules.audit.domain.AuditLogStore;

@Repository
public class JpaAuditLogStore implements AuditLogStore {

    private final AuditLogRepository auditLogRepository;

    public JpaAuditLogStore(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AuditLog append(AuditLog entry) {
        return auditLogRepository.saveAndFlush(entry);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditLog> findByUserId(UUID userId) {
        return auditLogRepository.findByUserIdOrderByCreatedAtAsc(userId);
    }
}
