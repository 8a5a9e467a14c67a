package com.matchatime.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

public record RotatedRefreshToken(UUID userId, String secret, OffsetDateTime expiresAt) {
}
