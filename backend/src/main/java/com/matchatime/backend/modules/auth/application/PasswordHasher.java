package com.matchatime.backend.modules.auth.application;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import com.matchatime.backend.global.config.AsyncConfig;
import com.matchatime.backend.global.config.AuthProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * BCrypt hashing and verification. All work runs on the dedicated hashing pool; callers receive a future.
 */
@Component
public class PasswordHasher {

    private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);

    private final BCryptPasswordEncoder encoder;
    private final Executor executor;
    private final String dummyHash;

    public PasswordHasher(AuthProperties authProperties,
                          @Qualifier(AsyncConfig.PASSWORD_HASH_EXECUTOR) Executor executor) {
        this.encoder = new BCryptPasswordEncoder(authProperties.bcryptCost());
        this.executor = executor;
        this.dummyHash = encoder.encode("matchatime-timing-equalizer");
    }

    public CompletableFuture<String> hash(String rawPassword) {
        return CompletableFuture.supplyAsync(() -> encoder.encode(rawPassword), executor);
    }

    /**
     * Completes with {@code false} for a wrong password and for missing or malformed hashes; never exceptionally
     * because of the stored value.
     */
    public CompletableFuture<Boolean> verify(String rawPassword, String storedHash) {
        if (storedHash == null || storedHash.isBlank()) {
            return verifyAgainstDummy(rawPassword);
        }
        return CompletableFuture.supplyAsync(() -> matchesSafely(rawPassword, storedHash), executor);
    }

    /**
     * Burns one verification's worth of work so that callers without an account to check take as long as those with one.
     */
    public CompletableFuture<Boolean> verifyAgainstDummy(String rawPassword) {
        return CompletableFuture.supplyAsync(() -> {
            encoder.matches(rawPassword == null ? "" : rawPassword, dummyHash);
            return false;
        }, executor);
    }

    private boolean matchesSafely(String rawPassword, String storedHash) {
        if (rawPassword == null) {
            return false;
        }
        try {
            return encoder.matches(rawPassword, storedHash);
        } catch (IllegalArgumentException e) {
            log.warn("Stored password hash could not be parsed: {}", e.getMessage());
            return false;
        }
    }
}
