package com.matchatime.backend.global.web.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RateLimiterMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterMaintenanceScheduler.class);

    private final RateLimiter rateLimiter;

    public RateLimiterMaintenanceScheduler(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedDelayString = "${app.jobs.rate-limit-eviction-interval:PT10M}",
            initialDelayString = "${app.jobs.rate-limit-eviction-interval:PT10M}")
    public void evictIdleBuckets() {
        int evicted = rateLimiter.evictIdle();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate-limit buckets", evicted);
        }
    }
}
