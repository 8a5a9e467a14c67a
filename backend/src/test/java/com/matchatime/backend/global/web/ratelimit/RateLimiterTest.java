package com.matchatime.backend.global.web.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.matchatime.backend.global.config.RateLimitProperties;
import com.matchatime.backend.global.config.RateLimitProperties.Tier;

import io.github.bucket4j.TimeMeter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RateLimiterTest {

    private final ManualTimeMeter timeMeter = new ManualTimeMeter();
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        RateLimitProperties properties = new RateLimitProperties(
                new Tier(2, 3), new Tier(5, 5), new Tier(10, 20), Duration.ofMinutes(10));
        rateLimiter = new RateLimiter(properties, timeMeter);
    }

    @Test
    @DisplayName("burst + 1 requests within the window: the last one is denied")
    void burstPlusOneIsDenied() {
        for (int i = 0; i < 3; i++) {
            assertThat(rateLimiter.tryConsume(EndpointTier.SENSITIVE, "10.0.0.1").allowed()).isTrue();
        }

        RateLimitDecision denied = rateLimiter.tryConsume(EndpointTier.SENSITIVE, "10.0.0.1");

        assertThat(denied.allowed()).isFalse();
        assertThat(denied.retryAfterSeconds()).isEqualTo(1);
    }

    @Test
    void tokensRefillOverTime() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryConsume(EndpointTier.SENSITIVE, "10.0.0.1");
        }
        assertThat(rateLimiter.tryConsume(EndpointTier.SENSITIVE, "10.0.0.1").allowed()).isFalse();

        timeMeter.advance(Duration.ofMillis(500));

        assertThat(rateLimiter.tryConsume(EndpointTier.SENSITIVE, "10.0.0.1").allowed()).isTrue();
        assertThat(rateLimiter.tryConsume(EndpointTier.SENSITIVE, "10.0.0.1").allowed()).isFalse();
    }

    @Test
    void bucketsAreIndependentPerClientAndTier() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryConsume(EndpointTier.SENSITIVE, "10.0.0.1");
        }

        assertThat(rateLimiter.tryConsume(EndpointTier.SENSITIVE, "10.0.0.2").allowed()).isTrue();
        assertThat(rateLimiter.tryConsume(EndpointTier.AUTH, "10.0.0.1").allowed()).isTrue();
    }

    @Test
    void remainingTokensAreReported() {
        assertThat(rateLimiter.tryConsume(EndpointTier.GENERAL, "10.0.0.1").remaining()).isEqualTo(19);
    }

    @Test
    void idleBucketsAreEvicted() {
        rateLimiter.tryConsume(EndpointTier.GENERAL, "10.0.0.1");
        timeMeter.advance(Duration.ofMinutes(5));
        rateLimiter.tryConsume(EndpointTier.GENERAL, "10.0.0.2");
        timeMeter.advance(Duration.ofMinutes(6));

        assertThat(rateLimiter.evictIdle()).isEqualTo(1);
        assertThat(rateLimiter.trackedBucketCount()).isEqualTo(1);
    }

    private static final class ManualTimeMeter implements TimeMeter {

        private final AtomicLong nanos = new AtomicLong(TimeUnit.SECONDS.toNanos(1_000));

        void advance(Duration duration) {
            nanos.addAndGet(duration.toNanos());
        }

        @Override
        public long currentTimeNanos() {
            return nanos.get();
        }

        @Override
        public boolean isWallClockBased() {
            return false;
        }
    }
}
