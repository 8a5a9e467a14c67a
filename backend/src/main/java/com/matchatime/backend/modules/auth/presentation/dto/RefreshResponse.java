package com.matchatime.backend.modules.auth.presentation.dto;

public record RefreshResponse(String token, String message) {
}
