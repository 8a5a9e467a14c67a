package com.matchatime.backend.modules.user.infrastructure.mail;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import com.matchatime.backend.global.config.AppEnvironment;
import com.matchatime.backend.global.config.WebProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

@ExtendWith(MockitoExtension.class)
class SmtpEmailSenderTest {

    @Mock
    private JavaMailSender javaMailSender;

    @Mock
    private ObjectProvider<JavaMailSender> mailSenderProvider;

    private AccountLinks links;

    @BeforeEach
    void setUp() {
        links = new AccountLinks(web(AppEnvironment.PRODUCTION));
    }

    @Test
    void verificationMailLinksToFrontend() {
        SmtpEmailSender sender = new SmtpEmailSender(javaMailSender,
                new MailProperties(true, "no-reply@app.example", "Matcha Time"), links);

        sender.sendVerificationEmail("alice@example.com", "alice", "abc123");

        ArgumentCaptor<SimpleMailMessage> message = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(javaMailSender).send(message.capture());
        assertThat(message.getValue().getTo()).containsExactly("alice@example.com");
        assertThat(message.getValue().getFrom()).isEqualTo("Matcha Time <no-reply@app.example>");
        assertThat(message.getValue().getText()).contains("https://app.example/verify-email?token=abc123");
    }

    @Test
    void mailConfigFallsBackToLoggingOnlyInDevelopment() {
        MailConfig config = new MailConfig();
        when(mailSenderProvider.getIfAvailable()).thenReturn(javaMailSender, (JavaMailSender) null);

        assertThat(config.emailSender(new MailProperties(false, "a@b.c", "n"), web(AppEnvironment.DEVELOPMENT),
                links, mailSenderProvider)).isInstanceOf(LoggingEmailSender.class);
        assertThat(config.emailSender(new MailProperties(true, "a@b.c", "n"), web(AppEnvironment.DEVELOPMENT),
                links, mailSenderProvider)).isInstanceOf(LoggingEmailSender.class);
    }

    @Test
    void mailConfigRefusesToLogTokenLinksInProduction() {
        MailConfig config = new MailConfig();
        when(mailSenderProvider.getIfAvailable()).thenReturn(javaMailSender, (JavaMailSender) null);

        assertThatThrownBy(() -> config.emailSender(new MailProperties(false, "a@b.c", "n"),
                web(AppEnvironment.PRODUCTION), links, mailSenderProvider))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("app.mail.enabled must be true outside development");
        assertThatThrownBy(() -> config.emailSender(new MailProperties(true, "a@b.c", "n"),
                web(AppEnvironment.PRODUCTION), links, mailSenderProvider))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("app.mail.enabled is true but no JavaMailSender is configured");
    }

    @Test
    void mailConfigUsesSmtpWhenEnabled() {
        when(mailSenderProvider.getIfAvailable()).thenReturn(javaMailSender);

        assertThat(new MailConfig().emailSender(new MailProperties(true, "a@b.c", "n"), web(AppEnvironment.PRODUCTION),
                links, mailSenderProvider)).isInstanceOf(SmtpEmailSender.class);
    }

    @Test
    void resetLinkEncodesToken() {
        assertThat(links.resetPassword("a b")).isEqualTo("https://app.example/reset-password?token=a+b");
    }

    private static WebProperties web(AppEnvironment environment) {
        return new WebProperties(environment, "https://app.example/", new WebProperties.Cookie(null),
                new WebProperties.Web(false), new WebProperties.Timing(Duration.ZERO));
    }
}
