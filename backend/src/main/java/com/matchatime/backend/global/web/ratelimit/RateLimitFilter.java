package com.matchatime.backend.global.web.ratelimit;

import java.io.IOException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.matchatime.backend.global.error.ProblemResponse;
import com.matchatime.backend.global.web.ClientIpResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/**
 * Rejects over-limit callers with 429 before any handler runs.
 */
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RATE_LIMITED_DETAIL = "Too many requests. Please try again later.";

    private final RateLimiter rateLimiter;
    private final EndpointTierResolver tierResolver;
    private final ClientIpResolver clientIpResolver;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(RateLimiter rateLimiter, EndpointTierResolver tierResolver,
                           ClientIpResolver clientIpResolver, ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.tierResolver = tierResolver;
        this.clientIpResolver = clientIpResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        EndpointTier tier = tierResolver.resolve(request);
        String clientIp = clientIpResolver.resolve(request);
        RateLimitDecision decision = rateLimiter.tryConsume(tier, clientIp);

        if (!decision.allowed()) {
            log.info("Rate limit exceeded: tier={}, path={}", tier, request.getRequestURI());
            ProblemResponse body = ProblemResponse.of(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED",
                    RATE_LIMITED_DETAIL, request.getRequestURI());
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
            response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
            response.getWriter().write(objectMapper.writeValueAsString(body));
            return;
        }

        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
        return "OPTIONS".equalsIgnoreCase(request.getMethod()) || path.startsWith("/actuator");
    }
}
