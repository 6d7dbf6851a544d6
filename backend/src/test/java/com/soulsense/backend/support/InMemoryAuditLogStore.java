package com.soulsense.backend.support;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.soulsense.backend.modules.audit.domain.AuditAction;
import com.soulsense.backend.modules.audit.domain.AuditLog;
import com.soulsense.backend.modules.audit.domain.AuditLogStore;

public class InMemoryAuditLogStore implements AuditLogStore {

    private final List<AuditLog> entries = new ArrayList<>();

    @Override
    public synchronized AuditLog append(AuditLog entry) {
        EntityIds.assign(entry);
        entries.add(entry);
        return entry;
    }

    @Override
    public synchronized List<AuditLog> findByUserId(UUID userId) {
        return entries.stream()
                .filter(entry -> userId.equals(entry.getUserId()))
                .toList();
    }

    public synchronized List<AuditLog> all() {
        return List.copyOf(entries);
    }

    public synchronized List<AuditLog> byAction(AuditAction action) {
        return entries.stream()
                .filter(entry -> entry.getAction() == action)
                .toList();
    }
}
