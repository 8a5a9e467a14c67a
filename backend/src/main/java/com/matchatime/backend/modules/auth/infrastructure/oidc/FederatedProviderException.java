package com.matchatime.backend.modules.auth.infrastructure.oidc;

/**
 * The provider could not be reached or answered with something unusable.
 */
public class FederatedProviderException extends RuntimeException {

    public FederatedProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
