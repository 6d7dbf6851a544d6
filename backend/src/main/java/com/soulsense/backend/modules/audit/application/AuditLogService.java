package com.soulsense.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import com.soulsense.backend.modules.audit.config.AuditConfig;
import com.soulsense.backend.modules.audit.domain.AuditAction;
import com.soulsense.backend.modules.audit.domain.AuditLog;
import com.soulsense.backend.modules.audit.domain.AuditLogStore;

/**
 * Best-effort security event log. A failed write is reported through the return value and the
 * application log; it never aborts the calling flow.
 *
 * <p>Inside a transaction the entry is handed to the audit executor once that transaction has
 * completed, committed or rolled back, so the calling thread never needs a second connection and
 * the entry survives a rollback. The return value then means "accepted". Outside a transaction the
 * entry is written directly and the return value means "stored".
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogStore auditLogStore;
    private final Clock clock;
    private final Executor auditExecutor;

    @Autowired
    public AuditLogService(
            AuditLogStore auditLogStore,
            Clock clock,
            @Qualifier(AuditConfig.AUDIT_EXECUTOR) Executor auditExecutor
    ) {
        this.auditLogStore = auditLogStore;
        this.clock = clock;
        this.auditExecutor = auditExecutor;
    }

    public AuditLogService(AuditLogStore auditLogStore, Clock clock) {
        this(auditLogStore, clock, Runnable::run);
    }

    public boolean log(UUID userId, AuditAction action, String ipAddress, String userAgent,
                       Map<String, ?> details) {
        Objects.requireNonNull(action, "action is required");
        AuditLog entry;
        try {
            entry = new AuditLog(
                    userId,
                    action,
                    ipAddress,
                    AuditDetailsSanitizer.truncate(userAgent, AuditLog.MAX_USER_AGENT_LENGTH),
                    AuditDetailsSanitizer.sanitize(details),
                    OffsetDateTime.now(clock)
            );
        } catch (RuntimeException ex) {
            log.error("Failed to build audit entry action={} userId={}", action, userId, ex);
            return false;
        }

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    dispatch(entry);
                }
            });
            return true;
        }
        return write(entry);
    }

    public boolean log(UUID userId, AuditAction action, Map<String, ?> details) {
        return log(userId, action, null, null, details);
    }

    private void dispatch(AuditLog entry) {
        try {
            auditExecutor.execute(() -> write(entry));
        } catch (RejectedExecutionException ex) {
            log.error("Audit queue full, dropped entry action={} userId={}", entry.getAction(), entry.getUserId(), ex);
        }
    }

    private boolean write(AuditLog entry) {
        try {
            auditLogStore.append(entry);
            return true;
        } catch (RuntimeException ex) {
            log.error("Failed to write audit entry action={} userId={}", entry.getAction(), entry.getUserId(), ex);
            return false;
        }
    }
}
