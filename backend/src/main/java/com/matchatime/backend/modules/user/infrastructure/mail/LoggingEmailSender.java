package com.matchatime.backend.modules.user.infrastructure.mail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when SMTP delivery is disabled. Prints the links so they can be followed locally.
 */
public class LoggingEmailSender implements EmailSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingEmailSender.class);

    private final AccountLinks links;

    public LoggingEmailSender(AccountLinks links) {
        this.links = links;
    }

    @Override
    public void sendVerificationEmail(String to, String username, String token) {
        log.info("[mail disabled] verification email for {}: {}", to, links.verifyEmail(token));
    }

    @Override
    public void sendPasswordResetEmail(String to, String username, String token) {
        log.info("[mail disabled] password reset email for {}: {}", to, links.resetPassword(token));
    }

    @Override
    public void sendPasswordChangedNotification(String to, String username) {
        log.info("[mail disabled] password changed notice for {}", to);
    }
}
