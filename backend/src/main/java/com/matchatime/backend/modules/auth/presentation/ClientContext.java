package com.matchatime.backend.modules.auth.presentation;

import jakarta.servlet.http.HttpServletRequest;

import com.matchatime.backend.global.web.ClientIpResolver;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Caller metadata recorded on refresh sessions.
 */
@Component
public class ClientContext {

    private final ClientIpResolver clientIpResolver;

    public ClientContext(ClientIpResolver clientIpResolver) {
        this.clientIpResolver = clientIpResolver;
    }

    public String clientIp(HttpServletRequest request) {
        return clientIpResolver.resolve(request);
    }

    public String deviceInfo(HttpServletRequest request) {
        return request.getHeader(HttpHeaders.USER_AGENT);
    }
}
