package com.soulsense.backend.modules.ratelimit.config;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.soulsense.backend.modules.ratelimit.application.RateLimitFamily;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-family limits bound from {@code soulsense.rate-limit.families.<family>.*}.
 * Families that are not configured keep their built-in defaults.
 */
@ConfigurationProperties(prefix = "soulsense.rate-limit")
public class RateLimitProperties {

    private long maxKeys = 10_000;

    private Map<String, Limit> families = new LinkedHashMap<>();

    public long getMaxKeys() {
        return maxKeys;
    }

    public void setMaxKeys(long maxKeys) {
        this.maxKeys = maxKeys;
    }

    public Map<String, Limit> getFamilies() {
        return families;
    }

    public void setFamilies(Map<String, Limit> families) {
        this.families = families;
    }

    public Map<RateLimitFamily, Limit> resolve() {
        Map<RateLimitFamily, Limit> resolved = new EnumMap<>(RateLimitFamily.class);
        for (RateLimitFamily family : RateLimitFamily.values()) {
            Limit configured = families.get(family.getPropertyKey());
            resolved.put(family, configured != null ? configured : defaultFor(family));
        }
        return resolved;
    }

    static Limit defaultFor(RateLimitFamily family) {
        return switch (family) {
            case LOGIN, REGISTRATION, PASSWORD_RESET -> new Limit(10, Duration.ofSeconds(60));
            case ANALYTICS -> new Limit(30, Duration.ofSeconds(60));
            case OTP_ISSUE -> new Limit(1, Duration.ofSeconds(60));
            case OTP_VERIFY -> new Limit(5, Duration.ofMinutes(5));
        };
    }

    public static class Limit {

        private int maxRequests;
        private Duration window;

        public Limit() {
        }

        public Limit(int maxRequests, Duration window) {
            this.maxRequests = maxRequests;
            this.window = window;
        }

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }
}
