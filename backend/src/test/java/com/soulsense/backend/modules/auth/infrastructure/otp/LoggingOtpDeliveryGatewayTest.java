package com.soulsense.backend.modules.auth.infrastructure.otp;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LoggingOtpDeliveryGatewayTest {

    @Test
    void masksLocalPartOfAddress() {
        assertThat(LoggingOtpDeliveryGateway.mask("alice@example.com")).isEqualTo("a***@example.com");
        assertThat(LoggingOtpDeliveryGateway.mask("a@example.com")).isEqualTo("***@example.com");
        assertThat(LoggingOtpDeliveryGateway.mask(null)).isEqualTo("-");
    }
}
