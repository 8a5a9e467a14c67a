package com.matchatime.backend.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Secrets and lifetimes for access tokens, refresh sessions, action tokens and the federated login flow.
 */
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        String jwtSecret,
        String cookieSecret,
        @DefaultValue("24h") Duration accessTokenTtl,
        @DefaultValue("30d") Duration refreshTokenTtl,
        @DefaultValue("24h") Duration verificationTokenTtl,
        @DefaultValue("1h") Duration passwordResetTokenTtl,
        @DefaultValue("10m") Duration oidcFlowTtl,
        @DefaultValue("12") int bcryptCost,
        @DefaultValue("4") int hashPoolSize
) {
}
