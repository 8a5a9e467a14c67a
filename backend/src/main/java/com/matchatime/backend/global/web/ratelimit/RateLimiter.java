package com.matchatime.backend.global.web.ratelimit;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.matchatime.backend.global.config.RateLimitProperties;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.TimeMeter;

import org.springframework.stereotype.Component;

/**
 * Process-local token buckets keyed by tier and client address, refilled greedily.
 */
@Component
public class RateLimiter {

    private final RateLimitProperties properties;
    private final TimeMeter timeMeter;
    private final Map<String, TrackedBucket> buckets = new ConcurrentHashMap<>();

    public RateLimiter(RateLimitProperties properties, TimeMeter timeMeter) {
        this.properties = properties;
        this.timeMeter = timeMeter;
    }

    public RateLimitDecision tryConsume(EndpointTier tier, String clientKey) {
        TrackedBucket tracked = buckets.computeIfAbsent(tier.name() + ":" + clientKey, key -> newBucket(tier));
        tracked.lastSeenNanos().set(timeMeter.currentTimeNanos());

        ConsumptionProbe probe = tracked.bucket().tryConsumeAndReturnRemaining(1);
        if (probe.isConsumed()) {
            return RateLimitDecision.allow(probe.getRemainingTokens());
        }
        long nanosToWait = probe.getNanosToWaitForRefill();
        long retryAfterSeconds = TimeUnit.NANOSECONDS.toSeconds(nanosToWait + TimeUnit.SECONDS.toNanos(1) - 1);
        return RateLimitDecision.deny(retryAfterSeconds);
    }

    /**
     * Drops buckets not touched within the configured idle window. Returns the number removed.
     */
    public int evictIdle() {
        long cutoff = timeMeter.currentTimeNanos() - properties.idleEviction().toNanos();
        int before = buckets.size();
        buckets.entrySet().removeIf(entry -> entry.getValue().lastSeenNanos().get() < cutoff);
        return before - buckets.size();
    }

    int trackedBucketCount() {
        return buckets.size();
    }

    private TrackedBucket newBucket(EndpointTier tier) {
        RateLimitProperties.Tier limits = limitsFor(tier);
        Bandwidth bandwidth = Bandwidth.builder()
                .capacity(Math.max(1, limits.burst()))
                .refillGreedy(Math.max(1, limits.perSecond()), Duration.ofSeconds(1))
                .build();
        Bucket bucket = Bucket.builder()
                .addLimit(bandwidth)
                .withCustomTimePrecision(timeMeter)
                .build();
        return new TrackedBucket(bucket, new AtomicLong(timeMeter.currentTimeNanos()));
    }

    private RateLimitProperties.Tier limitsFor(EndpointTier tier) {
        return switch (tier) {
            case SENSITIVE -> properties.sensitive();
            case AUTH -> properties.auth();
            case GENERAL -> properties.general();
        };
    }

    private record TrackedBucket(Bucket bucket, AtomicLong lastSeenNanos) {
    }
}
