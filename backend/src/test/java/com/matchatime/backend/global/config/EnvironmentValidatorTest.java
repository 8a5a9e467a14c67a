package com.matchatime.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private static final String JWT_SECRET = "j".repeat(32);
    private static final String COOKIE_SECRET = "c".repeat(64);

    @Test
    void validConfigurationPasses() {
        EnvironmentValidator validator = validator(JWT_SECRET, COOKIE_SECRET, 12, "http://localhost:5173");

        assertThat(validator.collectProblems()).isEmpty();
        assertThatCode(validator::validateEnvironment).doesNotThrowAnyException();
    }

    @Test
    void shortSecretsAreReported() {
        EnvironmentValidator validator = validator("j".repeat(31), "c".repeat(63), 12, "http://localhost:5173");

        assertThat(validator.collectProblems()).containsExactly(
                "app.auth.jwt-secret must be at least 32 characters long",
                "app.auth.cookie-secret must be at least 64 characters long");
    }

    @Test
    void missingValuesFailStartup() {
        EnvironmentValidator validator = validator(null, null, 3, "");

        assertThat(validator.collectProblems()).hasSize(4);
        assertThatThrownBy(validator::validateEnvironment)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Invalid configuration: ")
                .hasMessageContaining("app.cors.allowed-origins cannot be empty")
                .hasMessageContaining("app.auth.bcrypt-cost must be between 4 and 31");
    }

    @Test
    void productionWithoutMailDeliveryFailsStartup() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.cors.allowed-origins", "https://app.example")
                .withProperty("app.environment", "production");
        EnvironmentValidator validator = validator(environment, JWT_SECRET, COOKIE_SECRET, 12);

        assertThat(validator.collectProblems()).containsExactly("app.mail.enabled must be true outside development");
        assertThatThrownBy(validator::validateEnvironment).isInstanceOf(IllegalStateException.class);

        environment.setProperty("app.mail.enabled", "true");
        assertThat(validator.collectProblems()).isEmpty();
    }

    @Test
    void unsetEnvironmentCountsAsProduction() {
        MockEnvironment environment = new MockEnvironment().withProperty("app.cors.allowed-origins", "https://app.example");

        assertThat(validator(environment, JWT_SECRET, COOKIE_SECRET, 12).collectProblems())
                .containsExactly("app.mail.enabled must be true outside development");
    }

    private static EnvironmentValidator validator(String jwtSecret, String cookieSecret, int bcryptCost,
                                                  String origins) {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.cors.allowed-origins", origins)
                .withProperty("app.environment", "development");
        return validator(environment, jwtSecret, cookieSecret, bcryptCost);
    }

    private static EnvironmentValidator validator(MockEnvironment environment, String jwtSecret, String cookieSecret,
                                                  int bcryptCost) {
        AuthProperties properties = new AuthProperties(jwtSecret, cookieSecret, Duration.ofHours(24),
                Duration.ofDays(30), Duration.ofHours(24), Duration.ofHours(1), Duration.ofMinutes(10), bcryptCost, 4);
        return new EnvironmentValidator(environment, properties);
    }
}
