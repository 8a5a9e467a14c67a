package com.matchatime.backend.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Deployment-facing settings shared by the cookie factory, CORS and the request pipeline filters.
 */
@ConfigurationProperties(prefix = "app")
public record WebProperties(
        @DefaultValue("production") AppEnvironment environment,
        String frontendUrl,
        @DefaultValue Cookie cookie,
        @DefaultValue Web web,
        @DefaultValue Timing timing
) {

    public record Cookie(String domain) {
    }

    public record Web(@DefaultValue("false") boolean trustProxy) {
    }

    public record Timing(@DefaultValue("250ms") Duration floor) {
    }
}
