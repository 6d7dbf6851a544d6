package com.soulsense.backend.modules.auth.domain;

/**
 * Purpose a one-time code was issued for. Codes never verify across purposes.
 */
public enum OtpType {
    RESET_PASSWORD,
    LOGIN_2FA,
    SETUP_2FA
}
