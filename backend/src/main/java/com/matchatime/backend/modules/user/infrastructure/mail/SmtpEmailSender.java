package com.matchatime.backend.modules.user.infrastructure.mail;

import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

public class SmtpEmailSender implements EmailSender {

    private final JavaMailSender mailSender;
    private final MailProperties properties;
    private final AccountLinks links;

    public SmtpEmailSender(JavaMailSender mailSender, MailProperties properties, AccountLinks links) {
        this.mailSender = mailSender;
        this.properties = properties;
        this.links = links;
    }

    @Override
    public void sendVerificationEmail(String to, String username, String token) {
        send(to, "Verify your email address", """
                Hi %s,

                Welcome to Matcha Time! Please confirm your email address by opening the link below:

                %s

                This link expires in 24 hours. If you did not create an account, you can ignore this email.
                """.formatted(username, links.verifyEmail(token)));
    }

    @Override
    public void sendPasswordResetEmail(String to, String username, String token) {
        send(to, "Reset your password", """
                Hi %s,

                We received a request to reset your password. Open the link below to choose a new one:

                %s

                This link expires in 1 hour. If you did not request a reset, you can ignore this email.
                """.formatted(username, links.resetPassword(token)));
    }

    @Override
    public void sendPasswordChangedNotification(String to, String username) {
        send(to, "Your password was changed", """
                Hi %s,

                The password for your Matcha Time account was just changed and all other sessions were signed out.

                If this was not you, reset your password immediately.
                """.formatted(username));
    }

    private void send(String to, String subject, String body) {
        SimpleMailMessage msg = new SimpleMailMessage();
        msg.setFrom(properties.fromName() + " <" + properties.fromAddress() + ">");
        msg.setTo(to);
        msg.setSubject(subject);
        msg.setText(body);
        mailSender.send(msg);
    }
}
