package com.matchatime.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import com.matchatime.backend.global.config.WebProperties;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the caller address used for rate-limit keys and session metadata.
 * {@code X-Forwarded-For} is honoured only behind a trusted proxy, and only its first hop.
 */
@Component
public class ClientIpResolver {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    static final String UNKNOWN = "unknown";

    private final boolean trustProxy;

    public ClientIpResolver(WebProperties webProperties) {
        this.trustProxy = webProperties.web().trustProxy();
    }

    public String resolve(HttpServletRequest request) {
        if (trustProxy) {
            String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
            if (StringUtils.hasText(forwarded)) {
                String firstHop = forwarded.split(",")[0].trim();
                if (!firstHop.isEmpty()) {
                    return firstHop;
                }
            }
        }
        String remote = request.getRemoteAddr();
        return StringUtils.hasText(remote) ? remote : UNKNOWN;
    }
}
