package com.matchatime.backend.modules.auth.presentation;

import java.time.Duration;

import com.matchatime.backend.global.config.AuthProperties;
import com.matchatime.backend.global.config.WebProperties;

import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Builds the session cookies. All are HttpOnly on path {@code /}; {@code Secure} is dropped only in development.
 */
@Component
public class AuthCookieFactory {

    public static final String ACCESS_COOKIE = "access-session";
    public static final String REFRESH_COOKIE = "refresh-session";
    public static final String FLOW_COOKIE = "oidc-flow";

    private static final String LAX = "Lax";
    private static final String STRICT = "Strict";

    private final boolean development;
    private final String domain;
    private final AuthProperties authProperties;

    public AuthCookieFactory(WebProperties webProperties, AuthProperties authProperties) {
        this.development = webProperties.environment().isDevelopment();
        this.domain = webProperties.cookie().domain();
        this.authProperties = authProperties;
    }

    public ResponseCookie accessCookie(String accessToken) {
        return build(ACCESS_COOKIE, accessToken, LAX, authProperties.accessTokenTtl());
    }

    public ResponseCookie refreshCookie(String refreshSecret) {
        return build(REFRESH_COOKIE, refreshSecret, refreshSameSite(), authProperties.refreshTokenTtl());
    }

    public ResponseCookie flowCookie(String sealedFlowState) {
        return build(FLOW_COOKIE, sealedFlowState, LAX, authProperties.oidcFlowTtl());
    }

    public ResponseCookie clearAccessCookie() {
        return build(ACCESS_COOKIE, "", LAX, Duration.ZERO);
    }

    public ResponseCookie clearRefreshCookie() {
        return build(REFRESH_COOKIE, "", refreshSameSite(), Duration.ZERO);
    }

    public ResponseCookie clearFlowCookie() {
        return build(FLOW_COOKIE, "", LAX, Duration.ZERO);
    }

    private String refreshSameSite() {
        return development ? LAX : STRICT;
    }

    private ResponseCookie build(String name, String value, String sameSite, Duration maxAge) {
        ResponseCookie.ResponseCookieBuilder builder = ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(!development)
                .path("/")
                .sameSite(sameSite)
                .maxAge(maxAge);
        if (StringUtils.hasText(domain)) {
            builder.domain(domain);
        }
        return builder.build();
    }
}
