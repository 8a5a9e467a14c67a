package com.matchatime.backend.modules.auth.presentation.dto;

public record LoginResponse(String token, String refreshToken, UserProfileResponse user) {
}
