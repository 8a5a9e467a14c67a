package com.matchatime.backend.modules.user.application;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import com.matchatime.backend.global.error.ValidationFailureException;

import org.springframework.stereotype.Component;

/**
 * Format rules for account input. Violations surface as 400 with the rule's message.
 */
@Component
public class InputValidator {

    static final int MIN_PASSWORD_LENGTH = 8;
    static final int MAX_PASSWORD_LENGTH = 128;
    static final int MIN_USERNAME_LENGTH = 3;
    static final int MAX_USERNAME_LENGTH = 30;

    // ISO 639-1 codes with study content
    static final Set<String> SUPPORTED_LANGUAGES = Set.of("en", "es", "fr");

    private static final Pattern USERNAME_CHARS = Pattern.compile("^[A-Za-z0-9_-]+$");

    public void validateEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new ValidationFailureException("Email cannot be empty");
        }
        String trimmed = email.trim();
        if (!trimmed.contains("@") || !trimmed.contains(".")) {
            throw new ValidationFailureException("Invalid email format");
        }
        String[] parts = trimmed.split("@", -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new ValidationFailureException("Invalid email format");
        }
    }

    public void validatePassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new ValidationFailureException("Password must be at least 8 characters long");
        }
        if (password.length() > MAX_PASSWORD_LENGTH) {
            throw new ValidationFailureException("Password must be at most 128 characters long");
        }
        boolean hasLetter = password.chars().anyMatch(Character::isLetter);
        boolean hasDigit = password.chars().anyMatch(Character::isDigit);
        if (!hasLetter || !hasDigit) {
            throw new ValidationFailureException("Password must contain at least one letter and one number");
        }
    }

    public void validateUsername(String username) {
        if (username == null || username.isEmpty()) {
            throw new ValidationFailureException("Username cannot be empty");
        }
        if (username.length() < MIN_USERNAME_LENGTH) {
            throw new ValidationFailureException("Username must be at least 3 characters long");
        }
        if (username.length() > MAX_USERNAME_LENGTH) {
            throw new ValidationFailureException("Username must be at most 30 characters long");
        }
        if (!USERNAME_CHARS.matcher(username).matches()) {
            throw new ValidationFailureException(
                    "Username can only contain letters, numbers, underscores, and hyphens");
        }
    }

    /**
     * Accepts a supported ISO 639-1 code in any case and returns it lowercased.
     */
    public String validateLanguageCode(String code) {
        if (code == null || code.isBlank()) {
            throw new ValidationFailureException("Language code cannot be empty");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        if (!SUPPORTED_LANGUAGES.contains(normalized)) {
            throw new ValidationFailureException("Invalid language code: '" + code
                    + "'. Must be a valid ISO 639-1 code (e.g., 'en', 'es', 'fr')");
        }
        return normalized;
    }

    public static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
