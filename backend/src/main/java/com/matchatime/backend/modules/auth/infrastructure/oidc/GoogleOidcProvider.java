package com.matchatime.backend.modules.auth.infrastructure.oidc;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.api.client.googleapis.auth.oauth2.GoogleIdToken;
import com.google.api.client.googleapis.auth.oauth2.GoogleIdTokenVerifier;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.matchatime.backend.global.config.OidcProperties;
import com.matchatime.backend.global.crypto.TokenHashing;

import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Google as the OpenID Connect provider: authorization-code flow with PKCE, ID tokens verified against Google's
 * published keys.
 */
@Component
public class GoogleOidcProvider implements FederatedIdentityProvider {

    static final String SCOPE = "openid email profile";

    private final OidcProperties.Google google;
    private final RestClient restClient;
    private final GoogleIdTokenVerifier verifier;

    public GoogleOidcProvider(OidcProperties oidcProperties, RestClient.Builder restClientBuilder) {
        this.google = oidcProperties.google();
        this.restClient = restClientBuilder.build();
        this.verifier = new GoogleIdTokenVerifier
                .Builder(new NetHttpTransport(), GsonFactory.getDefaultInstance())
                .setAudience(Collections.singletonList(google.clientId()))
                .setIssuers(List.of(google.issuer(), "accounts.google.com"))
                .build();
    }

    @Override
    public String authorizationUrl(String state, String nonce, String codeChallenge) {
        return UriComponentsBuilder.fromHttpUrl(google.authorizationEndpoint())
                .queryParam("response_type", "code")
                .queryParam("client_id", google.clientId())
                .queryParam("redirect_uri", google.redirectUrl())
                .queryParam("scope", SCOPE)
                .queryParam("state", state)
                .queryParam("nonce", nonce)
                .queryParam("code_challenge", codeChallenge)
                .queryParam("code_challenge_method", "S256")
                .encode()
                .build()
                .toUriString();
    }

    @Override
    public String exchangeCode(String code, String codeVerifier) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("code_verifier", codeVerifier);
        form.add("client_id", google.clientId());
        form.add("client_secret", google.clientSecret());
        form.add("redirect_uri", google.redirectUrl());

        TokenEndpointResponse response;
        try {
            response = restClient.post()
                    .uri(google.tokenEndpoint())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(TokenEndpointResponse.class);
        } catch (RestClientException e) {
            throw new FederatedProviderException("Token endpoint request failed", e);
        }
        if (response == null || response.idToken() == null || response.idToken().isBlank()) {
            throw new FederatedProviderException("Token endpoint returned no id_token", null);
        }
        return response.idToken();
    }

    @Override
    public ProviderIdentityClaims verifyIdToken(String idToken, String expectedNonce) {
        GoogleIdToken verified;
        try {
            verified = verifier.verify(idToken);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new InvalidIdTokenException("ID token could not be verified", e);
        } catch (IOException e) {
            throw new FederatedProviderException("Could not fetch provider signing keys", e);
        }
        if (verified == null) {
            throw new InvalidIdTokenException("ID token signature, audience, issuer or expiry rejected");
        }

        GoogleIdToken.Payload payload = verified.getPayload();
        if (!TokenHashing.constantTimeEquals(expectedNonce, payload.getNonce())) {
            throw new InvalidIdTokenException("ID token nonce mismatch");
        }
        Map<String, Object> claims = payload;
        return new ProviderIdentityClaims(
                payload.getSubject(),
                payload.getEmail(),
                Boolean.TRUE.equals(payload.getEmailVerified()),
                (String) claims.get("name"),
                (String) claims.get("picture")
        );
    }

    record TokenEndpointResponse(@JsonProperty("id_token") String idToken,
                                 @JsonProperty("access_token") String accessToken) {
    }
}
