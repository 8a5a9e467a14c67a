package com.matchatime.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;

import com.matchatime.backend.global.crypto.SecureTokens;
import com.matchatime.backend.global.crypto.TokenHashing;
import com.matchatime.backend.global.error.AuthFailureException;
import com.matchatime.backend.global.error.ProblemException;
import com.matchatime.backend.modules.auth.application.OidcFlowCodec.InvalidFlowStateException;
import com.matchatime.backend.modules.auth.domain.FederatedIdentity;
import com.matchatime.backend.modules.auth.domain.OidcFlowState;
import com.matchatime.backend.modules.auth.infrastructure.oidc.FederatedIdentityProvider;
import com.matchatime.backend.modules.auth.infrastructure.oidc.FederatedProviderException;
import com.matchatime.backend.modules.auth.infrastructure.oidc.InvalidIdTokenException;
import com.matchatime.backend.modules.auth.infrastructure.oidc.ProviderIdentityClaims;
import com.matchatime.backend.modules.user.domain.AppUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Drives the authorization-code round trip with the federated provider. Flow secrets travel in an encrypted
 * cookie; nothing is kept server-side between {@link #begin()} and {@link #complete}.
 */
@Service
public class FederatedLoginService {

    private static final Logger log = LoggerFactory.getLogger(FederatedLoginService.class);

    static final int RANDOM_BYTES = 32;

    private final FederatedIdentityProvider identityProvider;
    private final OidcFlowCodec flowCodec;
    private final IdentityResolver identityResolver;
    private final SessionIssuer sessionIssuer;
    private final Clock clock;

    public FederatedLoginService(FederatedIdentityProvider identityProvider, OidcFlowCodec flowCodec,
                                 IdentityResolver identityResolver, SessionIssuer sessionIssuer, Clock clock) {
        this.identityProvider = identityProvider;
        this.flowCodec = flowCodec;
        this.identityResolver = identityResolver;
        this.sessionIssuer = sessionIssuer;
        this.clock = clock;
    }

    public FlowStart begin() {
        String verifier = SecureTokens.newTokenBase64Url(RANDOM_BYTES);
        String csrfToken = SecureTokens.newTokenBase64Url(RANDOM_BYTES);
        String nonce = SecureTokens.newTokenBase64Url(RANDOM_BYTES);

        OidcFlowState state = new OidcFlowState(csrfToken, nonce, verifier, clock.instant());
        String authorizationUrl = identityProvider.authorizationUrl(csrfToken, nonce, codeChallenge(verifier));
        return new FlowStart(authorizationUrl, flowCodec.seal(state));
    }

    public SessionTokens complete(String flowCookie, String code, String returnedState, String clientIp,
                                  String deviceInfo) {
        if (flowCookie == null || flowCookie.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "OIDC_FLOW_MISSING", "No sign-in flow in progress");
        }

        OidcFlowState state;
        try {
            state = flowCodec.open(flowCookie);
        } catch (InvalidFlowStateException e) {
            log.info("Rejected federated callback: {}", e.getMessage());
            throw new ProblemException(HttpStatus.BAD_REQUEST, "OIDC_FLOW_INVALID", "Sign-in flow is invalid or expired");
        }

        if (!TokenHashing.constantTimeEquals(state.csrfToken(), returnedState)) {
            log.warn("SECURITY: federated callback state mismatch from {}", clientIp);
            throw new ProblemException(HttpStatus.BAD_REQUEST, "OIDC_STATE_MISMATCH", "Sign-in state mismatch");
        }
        if (code == null || code.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "OIDC_FLOW_INVALID", "Authorization code missing");
        }

        ProviderIdentityClaims claims;
        try {
            String idToken = identityProvider.exchangeCode(code, state.pkceVerifier());
            claims = identityProvider.verifyIdToken(idToken, state.nonce());
        } catch (InvalidIdTokenException e) {
            log.warn("SECURITY: federated ID token rejected: {}", e.getMessage());
            throw new AuthFailureException("FEDERATED_TOKEN_INVALID", "Federated sign-in could not be verified");
        } catch (FederatedProviderException e) {
            log.error("Federated provider failure", e);
            throw new ProblemException(HttpStatus.BAD_GATEWAY, "FEDERATED_PROVIDER_ERROR",
                    "Sign-in provider is unavailable. Please try again later.", e);
        }

        if (claims.email() == null || claims.email().isBlank() || !claims.emailVerified()) {
            log.warn("SECURITY: federated sign-in refused for unverified email, subject {}", claims.subject());
            throw new AuthFailureException("EMAIL_NOT_VERIFIED", "Email address is not verified with the provider");
        }

        AppUser user = identityResolver.resolve(
                new FederatedIdentity(claims.subject(), claims.email(), claims.name(), claims.picture()));
        return sessionIssuer.startSession(user, clientIp, deviceInfo);
    }

    static String codeChallenge(String verifier) {
        byte[] digest = TokenHashing.sha256(verifier.getBytes(StandardCharsets.US_ASCII));
        return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
    }

    public record FlowStart(String authorizationUrl, String flowCookieValue) {
    }
}
