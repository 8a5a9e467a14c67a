package com.matchatime.backend.modules.user.domain;

import java.util.Optional;

/**
 * The credentials an account can authenticate with. Every account holds a password hash, a federated
 * identity, or both; there is no variant with neither.
 */
public sealed interface UserCredentials
        permits UserCredentials.PasswordOnly, UserCredentials.FederatedOnly, UserCredentials.Linked {

    Optional<String> findPasswordHash();

    Optional<String> findFederatedId();

    default boolean canUsePassword() {
        return findPasswordHash().isPresent();
    }

    default boolean isFederated() {
        return findFederatedId().isPresent();
    }

    /**
     * Returns credentials with the password hash set or replaced, keeping any federated identity.
     */
    default UserCredentials withPasswordHash(String passwordHash) {
        return of(passwordHash, findFederatedId().orElse(null));
    }

    /**
     * Returns credentials linked to the given federated identity, keeping any password hash.
     */
    default UserCredentials withFederatedId(String federatedId) {
        return of(findPasswordHash().orElse(null), federatedId);
    }

    static UserCredentials of(String passwordHash, String federatedId) {
        boolean hasPassword = passwordHash != null && !passwordHash.isBlank();
        boolean hasFederated = federatedId != null && !federatedId.isBlank();
        if (hasPassword && hasFederated) {
            return new Linked(passwordHash, federatedId);
        }
        if (hasPassword) {
            return new PasswordOnly(passwordHash);
        }
        if (hasFederated) {
            return new FederatedOnly(federatedId);
        }
        throw new IllegalStateException("An account needs a password hash or a federated identity");
    }

    record PasswordOnly(String passwordHash) implements UserCredentials {

        public PasswordOnly {
            requireText(passwordHash, "passwordHash");
        }

        @Override
        public Optional<String> findPasswordHash() {
            return Optional.of(passwordHash);
        }

        @Override
        public Optional<String> findFederatedId() {
            return Optional.empty();
        }
    }

    record FederatedOnly(String federatedId) implements UserCredentials {

        public FederatedOnly {
            requireText(federatedId, "federatedId");
        }

        @Override
        public Optional<String> findPasswordHash() {
            return Optional.empty();
        }

        @Override
        public Optional<String> findFederatedId() {
            return Optional.of(federatedId);
        }
    }

    record Linked(String passwordHash, String federatedId) implements UserCredentials {

        public Linked {
            requireText(passwordHash, "passwordHash");
            requireText(federatedId, "federatedId");
        }

        @Override
        public Optional<String> findPasswordHash() {
            return Optional.of(passwordHash);
        }

        @Override
        public Optional<String> findFederatedId() {
            return Optional.of(federatedId);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
