package com.matchatime.backend.modules.user.infrastructure.mail;

import com.matchatime.backend.global.config.WebProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

/**
 * SMTP delivery when enabled. The logging sender prints raw token links, so it is only allowed in development.
 */
@Configuration
public class MailConfig {

    private static final Logger log = LoggerFactory.getLogger(MailConfig.class);

    @Bean
    public EmailSender emailSender(MailProperties properties, WebProperties webProperties, AccountLinks links,
                                   ObjectProvider<JavaMailSender> mailSender) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (properties.enabled() && sender != null) {
            return new SmtpEmailSender(sender, properties, links);
        }
        if (!webProperties.environment().isDevelopment()) {
            throw new IllegalStateException(properties.enabled()
                    ? "app.mail.enabled is true but no JavaMailSender is configured"
                    : "app.mail.enabled must be true outside development");
        }
        if (properties.enabled()) {
            log.warn("app.mail.enabled is true but no JavaMailSender is configured; falling back to log output");
        }
        return new LoggingEmailSender(links);
    }
}
