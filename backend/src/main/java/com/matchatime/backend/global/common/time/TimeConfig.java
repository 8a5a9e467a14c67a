package com.matchatime.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;

import io.github.bucket4j.TimeMeter;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single UTC time source. Token expiry, auditing, cleanup cut-offs and rate-limit refill all read from it,
 * so tests can pin every one of them with a fixed clock.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public TimeMeter rateLimitTimeMeter(Clock clock) {
        return new ClockTimeMeter(clock);
    }

    static final class ClockTimeMeter implements TimeMeter {

        private final Clock clock;

        ClockTimeMeter(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long currentTimeNanos() {
            return TimeUnit.MILLISECONDS.toNanos(clock.millis());
        }

        @Override
        public boolean isWallClockBased() {
            return true;
        }
    }
}
