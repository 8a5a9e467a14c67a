package com.matchatime.backend.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.rate-limit")
public record RateLimitProperties(
        Tier sensitive,
        Tier auth,
        Tier general,
        @DefaultValue("10m") Duration idleEviction
) {

    public record Tier(long perSecond, long burst) {
    }
}
