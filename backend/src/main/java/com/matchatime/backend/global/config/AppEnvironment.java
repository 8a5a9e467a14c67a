package com.matchatime.backend.global.config;

/**
 * Deployment mode. Anything other than an explicit {@code development} value is treated as production.
 */
public enum AppEnvironment {
    DEVELOPMENT,
    PRODUCTION;

    public boolean isDevelopment() {
        return this == DEVELOPMENT;
    }
}
