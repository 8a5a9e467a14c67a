package com.matchatime.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.matchatime.backend.modules.user.domain.AppUser;

public record UserProfileResponse(
        UUID id,
        String username,
        String email,
        boolean emailVerified,
        String authProvider,
        boolean hasPassword,
        String profilePictureUrl,
        String nativeLanguage,
        String learningLanguage,
        OffsetDateTime createdAt
) {

    public static UserProfileResponse from(AppUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.isEmailVerified(),
                user.getAuthProvider().name(),
                user.getCredentials().canUsePassword(),
                user.getProfilePictureUrl(),
                user.getNativeLanguage(),
                user.getLearningLanguage(),
                user.getCreatedAt()
        );
    }
}
