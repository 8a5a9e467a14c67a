package com.matchatime.backend.modules.user.domain;

/**
 * How the account was created or last linked. Informational only; login decisions use {@link UserCredentials}.
 */
public enum AuthProvider {
    PASSWORD,
    FEDERATED
}
