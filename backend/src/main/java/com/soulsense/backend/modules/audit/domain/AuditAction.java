package com.soulsense.backend.modules.audit.domain;

public enum AuditAction {
    REGISTER,
    LOGIN,
    LOGIN_2FA_INITIATED,
    LOGOUT,
    PASSWORD_RESET,
    SESSION_CLEANUP,
    TWO_FACTOR_ENABLED,
    TWO_FACTOR_DISABLED,
    ACCOUNT_DEACTIVATED
}
