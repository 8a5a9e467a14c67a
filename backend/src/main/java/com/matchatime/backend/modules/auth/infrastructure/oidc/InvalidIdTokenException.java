package com.matchatime.backend.modules.auth.infrastructure.oidc;

/**
 * The ID token failed signature, audience, issuer, expiry or nonce checks.
 */
public class InvalidIdTokenException extends RuntimeException {

    public InvalidIdTokenException(String message) {
        super(message);
    }

    public InvalidIdTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
