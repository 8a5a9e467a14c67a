package com.matchatime.backend.modules.user.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record EmailRequest(@NotNull(message = "email is required") String email) {
}
