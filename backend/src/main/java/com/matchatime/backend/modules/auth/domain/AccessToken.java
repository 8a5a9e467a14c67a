package com.matchatime.backend.modules.auth.domain;

import java.time.Instant;

public record AccessToken(String value, Instant issuedAt, Instant expiresAt) {
}
