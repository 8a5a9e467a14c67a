package com.matchatime.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

public record IssuedRefreshToken(String secret, UUID sessionId, OffsetDateTime expiresAt) {
}
