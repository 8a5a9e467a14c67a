package com.matchatime.backend.modules.auth.domain;

import java.time.Instant;

/**
 * Client-held state of one authorization round trip. Lives only inside the encrypted flow cookie.
 */
public record OidcFlowState(String csrfToken, String nonce, String pkceVerifier, Instant issuedAt) {
}
