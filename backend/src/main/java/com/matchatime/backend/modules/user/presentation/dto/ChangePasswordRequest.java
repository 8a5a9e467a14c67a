package com.matchatime.backend.modules.user.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.NotNull;

public record ChangePasswordRequest(
        @JsonAlias("current_password") @NotNull(message = "currentPassword is required") String currentPassword,
        @JsonAlias("new_password") @NotNull(message = "newPassword is required") String newPassword
) {
}
