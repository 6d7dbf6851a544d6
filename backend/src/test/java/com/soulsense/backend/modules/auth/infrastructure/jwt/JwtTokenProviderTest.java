package com.soulsense.backend.modules.auth.infrastructure.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.Test;

class JwtTokenProviderTest {

    @Test
    void plainSecretIsUsedAsUtf8() {
        JwtTokenProvider provider = new JwtTokenProvider("plain-text-secret-that-is-long-enough-for-hs256");

        assertThat(provider.getSecretKey().getEncoded()).hasSize(47);
        assertThat(provider.getSecretKey().getAlgorithm()).isEqualTo("HmacSHA256");
    }

    @Test
    void prefixedSecretIsDecoded() {
        byte[] raw = new byte[48];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = (byte) i;
        }

        JwtTokenProvider provider = new JwtTokenProvider("base64:" + Base64.getEncoder().encodeToString(raw));

        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(raw);
    }

    @Test
    void unprefixedSecretIsNeverDecodedEvenWhenItLooksLikeBase64() {
        // 44 characters of valid base64 that would decode to 33 bytes
        String secret = "QUJDREVGR0hJSktMTU5PUFFSU1RVVldYWVphYmNkZWZn";

        JwtTokenProvider provider = new JwtTokenProvider(secret);

        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shortMissingOrMalformedSecretFailsFast() {
        assertThatThrownBy(() -> new JwtTokenProvider("too-short"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new JwtTokenProvider(" "))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new JwtTokenProvider("base64:not*base64*at*all"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("base64");
        assertThatThrownBy(() -> new JwtTokenProvider("base64:" + Base64.getEncoder().encodeToString(new byte[16])))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 bytes");
    }
}
