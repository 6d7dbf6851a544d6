package com.soulsense.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC-SHA256 signing key for access and pre-auth tokens.
 *
 * <p>A secret written as {@code base64:<encoded>} is decoded; any other secret is used as its UTF-8
 * bytes. Either way the key must be at least 32 bytes.
 */
@Component
public class JwtTokenProvider {

    public static final String BASE64_PREFIX = "base64:";
    static final int MIN_KEY_BYTES = 32;
    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secret) {
        this.secretKey = new SecretKeySpec(keyMaterial(secret), HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    /**
     * @throws IllegalStateException when the secret is missing, malformed or shorter than 32 bytes
     */
    public static byte[] keyMaterial(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret must be configured");
        }
        byte[] key;
        if (secret.startsWith(BASE64_PREFIX)) {
            try {
                key = Base64.getDecoder().decode(secret.substring(BASE64_PREFIX.length()).trim());
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException("jwt.secret has the base64: prefix but is not valid base64", ex);
            }
        } else {
            key = secret.getBytes(StandardCharsets.UTF_8);
        }
        if (key.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret must be at least " + MIN_KEY_BYTES + " bytes");
        }
        return key;
    }
}
