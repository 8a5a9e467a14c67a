package com.matchatime.backend.modules.user.presentation.dto;

/**
 * Absent fields are left unchanged.
 */
public record UpdateProfileRequest(String username, String email) {
}
