package com.matchatime.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
