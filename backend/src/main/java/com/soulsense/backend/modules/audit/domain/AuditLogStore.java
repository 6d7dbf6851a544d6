package com.soulsense.backend.modules.audit.domain;

import java.util.List;
import java.util.UUID;

/**
 * Append-only sink for audit entries. Each append commits on its own.
 */
public interface AuditLogStore {

    AuditLog append(AuditLog entry);

    List<AuditLog> findByUserId(UUID userId);
}
