package com.matchatime.backend.modules.auth.infrastructure.oidc;

public interface FederatedIdentityProvider {

    /**
     * Builds the authorization-code URL carrying the given state, nonce and S256 PKCE challenge.
     */
    String authorizationUrl(String state, String nonce, String codeChallenge);

    /**
     * Redeems the authorization code and returns the raw ID token.
     *
     * @throws FederatedProviderException on transport errors or an unusable response
     */
    String exchangeCode(String code, String codeVerifier);

    /**
     * @throws InvalidIdTokenException when the token is not acceptable or its nonce differs from {@code expectedNonce}
     */
    ProviderIdentityClaims verifyIdToken(String idToken, String expectedNonce);
}
