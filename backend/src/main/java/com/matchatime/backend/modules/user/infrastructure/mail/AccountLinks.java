package com.matchatime.backend.modules.user.infrastructure.mail;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import com.matchatime.backend.global.config.WebProperties;

import org.springframework.stereotype.Component;

/**
 * Frontend links embedded in account emails.
 */
@Component
public class AccountLinks {

    private final String frontendUrl;

    public AccountLinks(WebProperties webProperties) {
        String url = webProperties.frontendUrl() == null ? "" : webProperties.frontendUrl();
        this.frontendUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String verifyEmail(String token) {
        return frontendUrl + "/verify-email?token=" + URLEncoder.encode(token, StandardCharsets.UTF_8);
    }

    public String resetPassword(String token) {
        return frontendUrl + "/reset-password?token=" + URLEncoder.encode(token, StandardCharsets.UTF_8);
    }
}
