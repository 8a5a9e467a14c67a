package com.matchatime.backend.global.web.ratelimit;

/**
 * Rate-limit tiers. SENSITIVE and AUTH responses are also padded to the timing floor.
 */
public enum EndpointTier {
    SENSITIVE,
    AUTH,
    GENERAL;

    public boolean isTimingNormalized() {
        return this != GENERAL;
    }
}
