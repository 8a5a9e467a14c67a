package com.matchatime.backend.modules.user.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.matchatime.backend.global.error.ValidationFailureException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class InputValidatorTest {

    private final InputValidator validator = new InputValidator();

    @Test
    void acceptsWellFormedInput() {
        assertThatCode(() -> {
            validator.validateEmail("alice@example.com");
            validator.validatePassword("password123");
            validator.validateUsername("alice_kim-01");
        }).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {"alice", "alice@", "@example.com", "a@b@example.com", "alice@examplecom"})
    void rejectsMalformedEmail(String email) {
        assertThatThrownBy(() -> validator.validateEmail(email))
                .isInstanceOf(ValidationFailureException.class)
                .hasFieldOrPropertyWithValue("detailMessage", "Invalid email format");
    }

    @Test
    void passwordRulesHaveSpecificMessages() {
        assertThatThrownBy(() -> validator.validatePassword("short1"))
                .hasFieldOrPropertyWithValue("detailMessage", "Password must be at least 8 characters long");
        assertThatThrownBy(() -> validator.validatePassword("a1".repeat(65)))
                .hasFieldOrPropertyWithValue("detailMessage", "Password must be at most 128 characters long");
        assertThatThrownBy(() -> validator.validatePassword("onlyletters"))
                .hasFieldOrPropertyWithValue("detailMessage", "Password must contain at least one letter and one number");
        assertThatThrownBy(() -> validator.validatePassword("12345678"))
                .hasFieldOrPropertyWithValue("detailMessage", "Password must contain at least one letter and one number");
    }

    @Test
    void usernameRulesHaveSpecificMessages() {
        assertThatThrownBy(() -> validator.validateUsername(""))
                .hasFieldOrPropertyWithValue("detailMessage", "Username cannot be empty");
        assertThatThrownBy(() -> validator.validateUsername("ab"))
                .hasFieldOrPropertyWithValue("detailMessage", "Username must be at least 3 characters long");
        assertThatThrownBy(() -> validator.validateUsername("a".repeat(31)))
                .hasFieldOrPropertyWithValue("detailMessage", "Username must be at most 30 characters long");
        assertThatThrownBy(() -> validator.validateUsername("alice kim"))
                .hasFieldOrPropertyWithValue("detailMessage",
                        "Username can only contain letters, numbers, underscores, and hyphens");
    }

    @Test
    void supportedLanguageCodesAreNormalized() {
        assertThat(validator.validateLanguageCode("EN")).isEqualTo("en");
        assertThat(validator.validateLanguageCode(" fr ")).isEqualTo("fr");
    }

    @ParameterizedTest
    @ValueSource(strings = {"de", "eng", "xx", "e"})
    void rejectsUnsupportedLanguageCodes(String code) {
        assertThatThrownBy(() -> validator.validateLanguageCode(code))
                .isInstanceOf(ValidationFailureException.class)
                .hasFieldOrPropertyWithValue("detailMessage",
                        "Invalid language code: '" + code + "'. Must be a valid ISO 639-1 code (e.g., 'en', 'es', 'fr')");
    }

    @Test
    void emptyLanguageCodeHasItsOwnMessage() {
        assertThatThrownBy(() -> validator.validateLanguageCode(""))
                .hasFieldOrPropertyWithValue("detailMessage", "Language code cannot be empty");
        assertThatThrownBy(() -> validator.validateLanguageCode(null))
                .hasFieldOrPropertyWithValue("detailMessage", "Language code cannot be empty");
    }

    @Test
    void normalizeEmailTrimsAndLowercases() {
        assertThat(InputValidator.normalizeEmail("  Alice@Example.COM ")).isEqualTo("alice@example.com");
        assertThat(InputValidator.normalizeEmail(null)).isEmpty();
    }
}
