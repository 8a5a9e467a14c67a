package com.matchatime.backend.modules.user.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

public record UpdateLanguagePreferencesRequest(
        @JsonAlias("native_language") String nativeLanguage,
        @JsonAlias("learning_language") String learningLanguage
) {
}
