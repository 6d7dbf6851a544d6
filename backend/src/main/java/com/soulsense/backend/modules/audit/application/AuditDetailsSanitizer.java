package com.soulsense.backend.modules.audit.application;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Strips secrets out of audit details before they are stored.
 *
 * <p>A key is dropped when its lower-cased name contains any denylisted term, at any nesting
 * depth (maps and lists are walked). String values longer than {@value #MAX_VALUE_LENGTH}
 * characters are cut. Everything else is copied as is.
 */
public final class AuditDetailsSanitizer {

    public static final int MAX_VALUE_LENGTH = 500;
    public static final String TRUNCATION_MARKER = "...";

    private static final List<String> DENYLIST = List.of("password", "secret", "code", "token", "otp");

    private AuditDetailsSanitizer() {
    }

    public static Map<String, Object> sanitize(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return Map.of();
        }
        return sanitizeMap(details);
    }

    public static boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String normalized = key.toLowerCase(Locale.ROOT);
        for (String term : DENYLIST) {
            if (normalized.contains(term)) {
                return true;
            }
        }
        return false;
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength - TRUNCATION_MARKER.length()) + TRUNCATION_MARKER;
    }

    private static Map<String, Object> sanitizeMap(Map<?, ?> source) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (isSensitiveKey(key)) {
                continue;
            }
            sanitized.put(key, sanitizeValue(entry.getValue()));
        }
        return sanitized;
    }

    private static Object sanitizeValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return sanitizeMap(nested);
        }
        if (value instanceof Iterable<?> items) {
            List<Object> copy = new ArrayList<>();
            for (Object item : items) {
                copy.add(sanitizeValue(item));
            }
            return copy;
        }
        if (value instanceof String text) {
            return truncate(text, MAX_VALUE_LENGTH);
        }
        if (value == null || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        // enums, UUIDs, timestamps
        return truncate(value.toString(), MAX_VALUE_LENGTH);
    }
}
