package com.matchatime.backend.modules.user.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.NotNull;

public record ResetPasswordRequest(
        @NotNull(message = "token is required") String token,
        @JsonAlias("new_password") @NotNull(message = "newPassword is required") String newPassword
) {
}
