package com.soulsense.backend.modules.auth.application;

import java.util.Locale;
import java.util.regex.Pattern;

import com.soulsense.backend.modules.auth.domain.AuthErrorCode;
import com.soulsense.backend.modules.auth.domain.AuthException;
import com.soulsense.backend.modules.auth.domain.RegistrationFields;

/**
 * Input rules for registration and password changes. Violations are {@link AuthErrorCode#VALIDATION}
 * failures and are not audited.
 */
public final class CredentialPolicy {

    static final int USERNAME_MIN = 3;
    static final int USERNAME_MAX = 30;
    static final int PASSWORD_MIN = 8;
    static final int PASSWORD_MAX = 128;
    static final int AGE_MIN = 13;
    static final int AGE_MAX = 120;

    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9_.-]+$");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private CredentialPolicy() {
    }

    public static void validateRegistration(RegistrationFields fields) {
        if (fields == null) {
            throw invalid("Registration data is required");
        }
        validateUsername(fields.username());
        validateEmail(fields.email());
        validatePassword(fields.password());
        if (fields.age() != null && (fields.age() < AGE_MIN || fields.age() > AGE_MAX)) {
            throw invalid("Age must be between " + AGE_MIN + " and " + AGE_MAX);
        }
    }

    public static void validateUsername(String username) {
        String value = username == null ? "" : username.trim();
        if (value.length() < USERNAME_MIN || value.length() > USERNAME_MAX) {
            throw invalid("Username must be " + USERNAME_MIN + "-" + USERNAME_MAX + " characters");
        }
        if (!USERNAME.matcher(value).matches()) {
            throw invalid("Username may only contain letters, digits, '_', '.' and '-'");
        }
    }

    public static void validateEmail(String email) {
        if (email == null || email.length() > 320 || !EMAIL.matcher(email.trim()).matches()) {
            throw invalid("A valid email address is required");
        }
    }

    public static void validatePassword(String password) {
        if (password == null || password.length() < PASSWORD_MIN || password.length() > PASSWORD_MAX) {
            throw invalid("Password must be " + PASSWORD_MIN + "-" + PASSWORD_MAX + " characters");
        }
        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        boolean symbol = false;
        for (char c : password.toCharArray()) {
            if (Character.isUpperCase(c)) {
                upper = true;
            } else if (Character.isLowerCase(c)) {
                lower = true;
            } else if (Character.isDigit(c)) {
                digit = true;
            } else if (!Character.isWhitespace(c)) {
                symbol = true;
            }
        }
        if (!(upper && lower && digit && symbol)) {
            throw invalid("Password needs an upper-case letter, a lower-case letter, a digit and a symbol");
        }
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static AuthException invalid(String detail) {
        return new AuthException(AuthErrorCode.VALIDATION, detail);
    }
}
