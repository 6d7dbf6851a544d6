package com.soulsense.backend.modules.auth.application;

import java.util.Map;

import com.soulsense.backend.modules.audit.application.AuditLogService;
import com.soulsense.backend.modules.audit.domain.AuditAction;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SessionCleanupScheduler {

    private final SessionService sessionService;
    private final AuditLogService auditLogService;
    private final int maxAgeHours;

    public SessionCleanupScheduler(
            SessionService sessionService,
            AuditLogService auditLogService,
            @Value("${soulsense.session.max-age-hours:24}") int maxAgeHours
    ) {
        this.sessionService = sessionService;
        this.auditLogService = auditLogService;
        this.maxAgeHours = maxAgeHours;
    }

    @Scheduled(fixedDelayString = "${soulsense.session.cleanup-interval:PT1H}",
            initialDelayString = "${soulsense.session.cleanup-initial-delay:PT1M}")
    public void cleanupStaleSessions() {
        int cleaned = sessionService.cleanupStale(maxAgeHours);
        if (cleaned > 0) {
            auditLogService.log(null, AuditAction.SESSION_CLEANUP,
                    Map.of("sessions_deactivated", cleaned, "max_age_hours", maxAgeHours));
        }
    }
}
