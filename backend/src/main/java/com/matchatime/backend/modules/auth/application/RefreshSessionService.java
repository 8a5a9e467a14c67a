package com.matchatime.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.matchatime.backend.global.config.AuthProperties;
import com.matchatime.backend.global.crypto.SecureTokens;
import com.matchatime.backend.global.crypto.TokenHashing;
import com.matchatime.backend.global.error.AuthFailureException;
import com.matchatime.backend.modules.auth.domain.RefreshToken;
import com.matchatime.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Opaque, rotating refresh sessions. A secret is accepted once; rotation deletes its row and issues a new one
 * under a row lock so concurrent presentations of the same secret cannot both succeed.
 */
@Service
public class RefreshSessionService {

    private static final Logger log = LoggerFactory.getLogger(RefreshSessionService.class);

    public static final String INVALID_REFRESH_TOKEN = "Invalid refresh token";
    static final int SECRET_BYTES = 32;
    private static final int MAX_DEVICE_INFO_LENGTH = 255;
    private static final int MAX_IP_LENGTH = 64;

    private final RefreshTokenRepository refreshTokenRepository;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    public RefreshSessionService(RefreshTokenRepository refreshTokenRepository, AuthProperties authProperties,
                                 Clock clock) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.refreshTokenTtl = authProperties.refreshTokenTtl();
        this.clock = clock;
    }

    @Transactional
    public IssuedRefreshToken issue(UUID userId, String deviceInfo, String ipAddress) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String secret = SecureTokens.newTokenBase64Url(SECRET_BYTES);
        RefreshToken token = new RefreshToken(
                userId,
                TokenHashing.sha256Hex(secret),
                truncate(deviceInfo, MAX_DEVICE_INFO_LENGTH),
                truncate(ipAddress, MAX_IP_LENGTH),
                now,
                now.plus(refreshTokenTtl)
        );
        RefreshToken saved = refreshTokenRepository.save(token);
        return new IssuedRefreshToken(secret, saved.getId(), saved.getExpiresAt());
    }

    /**
     * Exchanges a refresh secret for a new one. The expired-row delete is committed even though the call fails.
     */
    @Transactional(noRollbackFor = AuthFailureException.class)
    public RotatedRefreshToken rotate(String secret) {
        if (secret == null || secret.isBlank()) {
            throw invalid();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<RefreshToken> locked = refreshTokenRepository.findByTokenHashForUpdate(TokenHashing.sha256Hex(secret));
        if (locked.isEmpty()) {
            log.warn("SECURITY: refresh token not found; unknown secret or possible reuse of a rotated token");
            throw invalid();
        }

        RefreshToken current = locked.get();
        if (current.isExpired(now)) {
            refreshTokenRepository.delete(current);
            log.info("Expired refresh token presented for user {}; session removed", current.getUserId());
            throw invalid();
        }

        refreshTokenRepository.delete(current);
        String nextSecret = SecureTokens.newTokenBase64Url(SECRET_BYTES);
        RefreshToken next = new RefreshToken(
                current.getUserId(),
                TokenHashing.sha256Hex(nextSecret),
                current.getDeviceInfo(),
                current.getIpAddress(),
                now,
                now.plus(refreshTokenTtl)
        );
        refreshTokenRepository.save(next);
        return new RotatedRefreshToken(current.getUserId(), nextSecret, next.getExpiresAt());
    }

    @Transactional
    public boolean revoke(String secret) {
        if (secret == null || secret.isBlank()) {
            return false;
        }
        return refreshTokenRepository.deleteByTokenHash(TokenHashing.sha256Hex(secret)) > 0;
    }

    @Transactional
    public int revokeAll(UUID userId) {
        return refreshTokenRepository.deleteAllByUserId(userId);
    }

    @Transactional
    public int cleanupExpired() {
        return refreshTokenRepository.deleteExpired(OffsetDateTime.now(clock));
    }

    public Duration getRefreshTokenTtl() {
        return refreshTokenTtl;
    }

    private static AuthFailureException invalid() {
        return new AuthFailureException("INVALID_REFRESH_TOKEN", INVALID_REFRESH_TOKEN);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
