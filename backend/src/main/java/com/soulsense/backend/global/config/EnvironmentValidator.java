package com.soulsense.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.soulsense.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Verifies the security-relevant settings once the application is up.
 * A missing or weak signing secret aborts start-up instead of issuing forgeable tokens.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEVELOPMENT_SECRET = "dev-soulsense-jwt-secret-change-in-production-2026";

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment validation failed: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        String[] requiredVars = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "jwt.refresh-expiration"
        };
        for (String var : requiredVars) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add("missing " + var);
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        boolean relaxedProfile = environment.acceptsProfiles(Profiles.of("dev", "test"));
        if (!relaxedProfile && jwtSecret.filter(DEVELOPMENT_SECRET::equals).isPresent()) {
            problems.add("jwt.secret still holds the development default");
        }
        jwtSecret.filter(secret -> !secret.isBlank()).ifPresent(secret -> {
            try {
                JwtTokenProvider.keyMaterial(secret);
            } catch (IllegalStateException ex) {
                problems.add(ex.getMessage());
            }
        });

        Optional<String> jwtExpiration = Optional.ofNullable(environment.getProperty("jwt.expiration"));
        if (jwtExpiration.isPresent()) {
            try {
                long expiration = Long.parseLong(jwtExpiration.get());
                if (expiration < 60000 || expiration > 86400000) { // 1 minute to 24 hours
                    problems.add("jwt.expiration must be within 60000-86400000 ms");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration must be numeric");
            }
        }
        return problems;
    }
}
