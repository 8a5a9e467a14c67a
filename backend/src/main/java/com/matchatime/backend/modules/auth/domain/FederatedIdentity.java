package com.matchatime.backend.modules.auth.domain;

/**
 * Identity asserted by the federated provider after a verified sign-in.
 */
public record FederatedIdentity(String externalId, String email, String name, String pictureUrl) {
}
