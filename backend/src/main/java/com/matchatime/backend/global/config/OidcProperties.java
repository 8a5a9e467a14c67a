package com.matchatime.backend.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.oidc")
public record OidcProperties(Google google) {

    public record Google(
            String clientId,
            String clientSecret,
            String redirectUrl,
            @DefaultValue("https://accounts.google.com/o/oauth2/v2/auth") String authorizationEndpoint,
            @DefaultValue("https://oauth2.googleapis.com/token") String tokenEndpoint,
            @DefaultValue("https://accounts.google.com") String issuer
    ) {
    }
}
