package com.matchatime.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required secrets are missing or too weak to be used for signing and cookie encryption,
 * or when a production deployment has no real mail delivery.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final int MIN_JWT_SECRET_LENGTH = 32;
    static final int MIN_COOKIE_SECRET_LENGTH = 64;

    private final Environment environment;
    private final AuthProperties authProperties;

    public EnvironmentValidator(Environment environment, AuthProperties authProperties) {
        this.environment = environment;
        this.authProperties = authProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration check failed: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration check passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        String jwtSecret = Optional.ofNullable(authProperties.jwtSecret()).orElse("");
        if (jwtSecret.length() < MIN_JWT_SECRET_LENGTH) {
            problems.add("app.auth.jwt-secret must be at least " + MIN_JWT_SECRET_LENGTH + " characters long");
        }

        String cookieSecret = Optional.ofNullable(authProperties.cookieSecret()).orElse("");
        if (cookieSecret.length() < MIN_COOKIE_SECRET_LENGTH) {
            problems.add("app.auth.cookie-secret must be at least " + MIN_COOKIE_SECRET_LENGTH + " characters long");
        }

        String origins = environment.getProperty("app.cors.allowed-origins", "");
        if (origins.isBlank()) {
            problems.add("app.cors.allowed-origins cannot be empty");
        }

        boolean development = AppEnvironment.DEVELOPMENT.name()
                .equalsIgnoreCase(environment.getProperty("app.environment", "production").trim());
        if (!development && !environment.getProperty("app.mail.enabled", Boolean.class, false)) {
            problems.add("app.mail.enabled must be true outside development");
        }

        if (authProperties.bcryptCost() < 4 || authProperties.bcryptCost() > 31) {
            problems.add("app.auth.bcrypt-cost must be between 4 and 31");
        }
        return problems;
    }
}
