package com.soulsense.backend.modules.audit.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class AuditDetailsSanitizerTest {

    @Test
    void dropsSensitiveKeysAtAnyDepth() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("refresh_token", "abc");
        nested.put("device", "phone");

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("password", "hunter2");
        details.put("OTP_Code", "123456");
        details.put("clientSecret", "s3cr3t");
        details.put("status", "ok");
        details.put("context", nested);
        details.put("items", List.of(Map.of("accessToken", "x", "kept", 1)));

        Map<String, Object> sanitized = AuditDetailsSanitizer.sanitize(details);

        assertThat(sanitized).containsOnlyKeys("status", "context", "items");
        assertThat(sanitized.get("context")).isEqualTo(Map.of("device", "phone"));
        assertThat(sanitized.get("items")).isEqualTo(List.of(Map.of("kept", 1)));
    }

    @Test
    void truncatesLongStrings() {
        String longValue = "x".repeat(600);

        Map<String, Object> sanitized = AuditDetailsSanitizer.sanitize(Map.of("note", longValue));

        String stored = (String) sanitized.get("note");
        assertThat(stored).hasSize(AuditDetailsSanitizer.MAX_VALUE_LENGTH).endsWith("...");
    }

    @Test
    void keepsNumbersAndBooleans() {
        Map<String, Object> sanitized = AuditDetailsSanitizer.sanitize(Map.of("count", 3, "flag", true));

        assertThat(sanitized).containsEntry("count", 3).containsEntry("flag", true);
    }

    @Test
    void nullOrEmptyDetailsBecomeEmptyMap() {
        assertThat(AuditDetailsSanitizer.sanitize(null)).isEmpty();
        assertThat(AuditDetailsSanitizer.sanitize(Map.of())).isEmpty();
    }

    @Test
    void truncateLeavesShortValuesAlone() {
        assertThat(AuditDetailsSanitizer.truncate("short", 255)).isEqualTo("short");
        assertThat(AuditDetailsSanitizer.truncate(null, 255)).isNull();
        assertThat(AuditDetailsSanitizer.truncate("abcdefghij", 8)).isEqualTo("abcde...");
    }
}
