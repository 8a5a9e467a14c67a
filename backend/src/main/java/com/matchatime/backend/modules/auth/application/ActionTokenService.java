package com.matchatime.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.matchatime.backend.global.config.AuthProperties;
import com.matchatime.backend.global.crypto.SecureTokens;
import com.matchatime.backend.global.crypto.TokenHashing;
import com.matchatime.backend.modules.auth.domain.ActionToken;
import com.matchatime.backend.modules.auth.domain.ActionTokenPurpose;
import com.matchatime.backend.modules.auth.infrastructure.persistence.ActionTokenRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Single-use tokens for email verification and password reset. Issuing a token supersedes every unused token
 * of the same purpose for that user.
 */
@Service
public class ActionTokenService {

    static final int SECRET_BYTES = 32;

    private final ActionTokenRepository actionTokenRepository;
    private final AuthProperties authProperties;
    private final Clock clock;

    public ActionTokenService(ActionTokenRepository actionTokenRepository, AuthProperties authProperties, Clock clock) {
        this.actionTokenRepository = actionTokenRepository;
        this.authProperties = authProperties;
        this.clock = clock;
    }

    @Transactional
    public String issue(UUID userId, ActionTokenPurpose purpose) {
        return issue(userId, purpose, defaultTtl(purpose));
    }

    @Transactional
    public String issue(UUID userId, ActionTokenPurpose purpose, Duration ttl) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        actionTokenRepository.markUnusedAsUsed(userId, purpose, now);

        String secret = SecureTokens.newTokenHex(SECRET_BYTES);
        actionTokenRepository.save(new ActionToken(userId, purpose, TokenHashing.sha256Hex(secret), now, now.plus(ttl)));
        return secret;
    }

    /**
     * Marks the token used and returns its owner, or empty when it is unknown, expired, already used or bound to
     * another purpose. Callers cannot tell those cases apart.
     */
    @Transactional
    public Optional<UUID> consume(String secret, ActionTokenPurpose purpose) {
        if (secret == null || secret.isBlank()) {
            return Optional.empty();
        }
        String tokenHash = TokenHashing.sha256Hex(secret);
        int updated = actionTokenRepository.consume(tokenHash, purpose, OffsetDateTime.now(clock));
        if (updated != 1) {
            return Optional.empty();
        }
        return actionTokenRepository.findUserIdByTokenHash(tokenHash);
    }

    @Transactional
    public int cleanupExpired() {
        return actionTokenRepository.deleteExpiredOrUsed(OffsetDateTime.now(clock));
    }

    Duration defaultTtl(ActionTokenPurpose purpose) {
        return switch (purpose) {
            case EMAIL_VERIFICATION -> authProperties.verificationTokenTtl();
            case PASSWORD_RESET -> authProperties.passwordResetTokenTtl();
        };
    }
}
