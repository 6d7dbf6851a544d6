package com.soulsense.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Base64;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private static MockEnvironment completeEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/soulsense")
                .withProperty("jwt.secret", "production-secret-with-plenty-of-entropy-0123456789")
                .withProperty("jwt.expiration", "900000")
                .withProperty("jwt.refresh-expiration", "604800000");
    }

    @Test
    void completeEnvironmentPasses() {
        assertThat(new EnvironmentValidator(completeEnvironment()).collectProblems()).isEmpty();
    }

    @Test
    void missingSecretIsReported() {
        MockEnvironment environment = completeEnvironment().withProperty("jwt.secret", "");

        assertThat(new EnvironmentValidator(environment).collectProblems()).contains("missing jwt.secret");
    }

    @Test
    void developmentSecretIsRejectedOutsideDevProfiles() {
        MockEnvironment environment = completeEnvironment()
                .withProperty("jwt.secret", EnvironmentValidator.DEVELOPMENT_SECRET);

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .contains("jwt.secret still holds the development default");

        environment.setActiveProfiles("dev");
        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    @Test
    void shortSecretIsReportedWhetherPlainOrEncoded() {
        MockEnvironment plain = completeEnvironment().withProperty("jwt.secret", "short-secret");
        MockEnvironment encoded = completeEnvironment()
                .withProperty("jwt.secret", "base64:" + Base64.getEncoder().encodeToString(new byte[20]));

        assertThat(new EnvironmentValidator(plain).collectProblems())
                .containsExactly("jwt.secret must be at least 32 bytes");
        assertThat(new EnvironmentValidator(encoded).collectProblems())
                .containsExactly("jwt.secret must be at least 32 bytes");
    }

    @Test
    void accessTokenLifetimeMustBeSane() {
        MockEnvironment environment = completeEnvironment().withProperty("jwt.expiration", "1000");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.expiration");
    }
}
