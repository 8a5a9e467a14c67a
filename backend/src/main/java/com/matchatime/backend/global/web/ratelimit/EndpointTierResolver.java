package com.matchatime.backend.global.web.ratelimit;

import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.stereotype.Component;
import org.springframework.web.util.UrlPathHelper;

@Component
public class EndpointTierResolver {

    private static final Map<String, EndpointTier> TIERS_BY_PATH = Map.of(
            "/users/request-password-reset", EndpointTier.SENSITIVE,
            "/users/resend-verification", EndpointTier.SENSITIVE,
            "/users/register", EndpointTier.AUTH,
            "/users/login", EndpointTier.AUTH,
            "/users/reset-password", EndpointTier.AUTH
    );

    public EndpointTier resolve(HttpServletRequest request) {
        return resolve(UrlPathHelper.defaultInstance.getPathWithinApplication(request));
    }

    public EndpointTier resolve(String path) {
        if (path == null) {
            return EndpointTier.GENERAL;
        }
        String normalized = path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        return TIERS_BY_PATH.getOrDefault(normalized, EndpointTier.GENERAL);
    }
}
