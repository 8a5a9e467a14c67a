package com.matchatime.backend.modules.user.infrastructure.mail;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.mail")
public record MailProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("no-reply@matchatime.app") String fromAddress,
        @DefaultValue("Matcha Time") String fromName
) {
}
