package com.matchatime.backend.modules.user.presentation.dto;

import com.matchatime.backend.modules.auth.presentation.dto.UserProfileResponse;

public record LanguagePreferencesResponse(String message, UserProfileResponse user) {
}
