package com.matchatime.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

import com.matchatime.backend.global.config.AuthProperties;
import com.matchatime.backend.modules.auth.domain.AccessToken;
import com.matchatime.backend.modules.auth.domain.AccessTokenClaims;
import com.matchatime.backend.modules.auth.infrastructure.jwt.JwtSigningKeyProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.stereotype.Service;

/**
 * Mints and verifies the short-lived HS256 access tokens carried in the access cookie or bearer header.
 */
@Service
public class AccessTokenService {

    static final String EMAIL_CLAIM = "email";
    public static final String INVALID_TOKEN_MESSAGE = "Invalid or expired token";

    private final JwtSigningKeyProvider keyProvider;
    private final Duration accessTokenTtl;
    private final Clock clock;

    public AccessTokenService(JwtSigningKeyProvider keyProvider, AuthProperties authProperties, Clock clock) {
        this.keyProvider = keyProvider;
        this.accessTokenTtl = authProperties.accessTokenTtl();
        this.clock = clock;
    }

    public AccessToken mint(UUID userId, String email) {
        // JWT timestamps carry whole seconds
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(accessTokenTtl);

        String token = Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .claim(EMAIL_CLAIM, email)
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();
        return new AccessToken(token, now, expiresAt);
    }

    public AccessTokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidAccessTokenException(INVALID_TOKEN_MESSAGE, null);
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(keyProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (claims.getExpiration() == null || claims.getSubject() == null) {
                throw new InvalidAccessTokenException(INVALID_TOKEN_MESSAGE, null);
            }
            UUID userId = UUID.fromString(claims.getSubject());
            String email = claims.get(EMAIL_CLAIM, String.class);
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null;
            return new AccessTokenClaims(userId, email, issuedAt, claims.getExpiration().toInstant());
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidAccessTokenException(INVALID_TOKEN_MESSAGE, e);
        }
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public static class InvalidAccessTokenException extends RuntimeException {
        public InvalidAccessTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
