package com.matchatime.backend.modules.user.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record RegisterRequest(
        @NotNull(message = "username is required") String username,
        @NotNull(message = "email is required") String email,
        @NotNull(message = "password is required") String password
) {
}
