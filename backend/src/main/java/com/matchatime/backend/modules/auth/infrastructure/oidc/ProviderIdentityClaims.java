package com.matchatime.backend.modules.auth.infrastructure.oidc;

/**
 * Claims read from a verified ID token.
 */
public record ProviderIdentityClaims(String subject, String email, boolean emailVerified, String name,
                                     String picture) {
}
