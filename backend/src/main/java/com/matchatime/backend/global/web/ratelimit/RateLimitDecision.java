package com.matchatime.backend.global.web.ratelimit;

public record RateLimitDecision(boolean allowed, long remaining, long retryAfterSeconds) {

    public static RateLimitDecision allow(long remaining) {
        return new RateLimitDecision(true, remaining, 0);
    }

    public static RateLimitDecision deny(long retryAfterSeconds) {
        return new RateLimitDecision(false, 0, Math.max(1, retryAfterSeconds));
    }
}
