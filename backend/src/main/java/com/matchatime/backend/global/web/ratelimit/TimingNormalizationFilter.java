package com.matchatime.backend.global.web.ratelimit;

import java.io.IOException;
import java.time.Duration;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

/**
 * Holds back responses of credential-handling endpoints until a fixed floor has elapsed, so response
 * latency does not reveal whether an account exists.
 */
public class TimingNormalizationFilter extends OncePerRequestFilter {

    private final EndpointTierResolver tierResolver;
    private final long floorNanos;

    public TimingNormalizationFilter(EndpointTierResolver tierResolver, Duration floor) {
        this.tierResolver = tierResolver;
        this.floorNanos = floor.toNanos();
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        long startedAt = System.nanoTime();
        ContentCachingResponseWrapper buffered = new ContentCachingResponseWrapper(response);
        try {
            filterChain.doFilter(request, buffered);
        } finally {
            padToFloor(startedAt);
            buffered.copyBodyToResponse();
        }
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return floorNanos <= 0 || !tierResolver.resolve(request).isTimingNormalized();
    }

    private void padToFloor(long startedAt) {
        long remaining = floorNanos - (System.nanoTime() - startedAt);
        if (remaining <= 0) {
            return;
        }
        try {
            Thread.sleep(remaining / 1_000_000L, (int) (remaining % 1_000_000L));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
