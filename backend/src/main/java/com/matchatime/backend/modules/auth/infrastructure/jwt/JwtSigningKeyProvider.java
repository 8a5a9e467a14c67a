package com.matchatime.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.matchatime.backend.global.config.AuthProperties;

import org.springframework.stereotype.Component;

/**
 * HMAC key for access tokens, built from the raw bytes of the configured secret.
 */
@Component
public class JwtSigningKeyProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public JwtSigningKeyProvider(AuthProperties authProperties) {
        String secret = authProperties.jwtSecret() == null ? "" : authProperties.jwtSecret();
        this.secretKey = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
