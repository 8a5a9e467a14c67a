package com.matchatime.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matchatime.backend.global.config.AuthProperties;
import com.matchatime.backend.global.crypto.AesGcmCipher;
import com.matchatime.backend.global.crypto.AesGcmCipher.CipherTextException;
import com.matchatime.backend.modules.auth.domain.OidcFlowState;

import org.springframework.stereotype.Component;

/**
 * Seals {@link OidcFlowState} into an authenticated-encrypted cookie value and opens it again, enforcing the
 * flow lifetime.
 */
@Component
public class OidcFlowCodec {

    private final AesGcmCipher cipher;
    private final ObjectMapper objectMapper;
    private final Duration flowTtl;
    private final Clock clock;

    public OidcFlowCodec(AuthProperties authProperties, ObjectMapper objectMapper, Clock clock) {
        this.cipher = AesGcmCipher.fromSecret(authProperties.cookieSecret());
        this.objectMapper = objectMapper;
        this.flowTtl = authProperties.oidcFlowTtl();
        this.clock = clock;
    }

    public String seal(OidcFlowState state) {
        try {
            return cipher.encrypt(objectMapper.writeValueAsString(state));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("OIDC_FLOW_SERIALIZE_FAILED", e);
        }
    }

    /**
     * @throws InvalidFlowStateException when the value was tampered with, cannot be parsed, or is older than the flow TTL
     */
    public OidcFlowState open(String sealed) {
        OidcFlowState state;
        try {
            state = objectMapper.readValue(cipher.decrypt(sealed), OidcFlowState.class);
        } catch (CipherTextException | JsonProcessingException e) {
            throw new InvalidFlowStateException("Flow cookie could not be opened", e);
        }
        if (state.csrfToken() == null || state.nonce() == null || state.pkceVerifier() == null
                || state.issuedAt() == null) {
            throw new InvalidFlowStateException("Flow cookie is incomplete", null);
        }
        Instant now = clock.instant();
        if (state.issuedAt().plus(flowTtl).isBefore(now)) {
            throw new InvalidFlowStateException("Flow cookie expired", null);
        }
        return state;
    }

    public Duration getFlowTtl() {
        return flowTtl;
    }

    public static class InvalidFlowStateException extends RuntimeException {
        public InvalidFlowStateException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
