package com.matchatime.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.matchatime.backend.global.config.AuthProperties;
import com.matchatime.backend.modules.auth.application.OidcFlowCodec.InvalidFlowStateException;
import com.matchatime.backend.modules.auth.domain.OidcFlowState;

import org.junit.jupiter.api.Test;

class OidcFlowCodecTest {

    private static final Instant ISSUED_AT = Instant.parse("2025-01-01T00:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final AuthProperties properties = new AuthProperties("jwt-secret", "flow-cookie-secret",
            Duration.ofHours(24), Duration.ofDays(30), Duration.ofHours(24), Duration.ofHours(1),
            Duration.ofMinutes(10), 4, 1);

    @Test
    void sealedStateOpensWithinTtl() {
        OidcFlowState state = new OidcFlowState("csrf", "nonce", "verifier", ISSUED_AT);
        String sealed = codecAt(ISSUED_AT).seal(state);

        OidcFlowState opened = codecAt(ISSUED_AT.plus(Duration.ofMinutes(10))).open(sealed);

        assertThat(opened).isEqualTo(state);
        assertThat(sealed).doesNotContain("csrf", "nonce", "verifier");
    }

    @Test
    void stateOlderThanTtlIsRejected() {
        String sealed = codecAt(ISSUED_AT).seal(new OidcFlowState("csrf", "nonce", "verifier", ISSUED_AT));

        assertThatThrownBy(() -> codecAt(ISSUED_AT.plus(Duration.ofMinutes(10)).plusSeconds(1)).open(sealed))
                .isInstanceOf(InvalidFlowStateException.class)
                .hasMessage("Flow cookie expired");
    }

    @Test
    void tamperedCookieIsRejected() {
        String sealed = codecAt(ISSUED_AT).seal(new OidcFlowState("csrf", "nonce", "verifier", ISSUED_AT));
        char c = sealed.charAt(20);
        String tampered = sealed.substring(0, 20) + (c == 'A' ? 'B' : 'A') + sealed.substring(21);

        assertThatThrownBy(() -> codecAt(ISSUED_AT).open(tampered)).isInstanceOf(InvalidFlowStateException.class);
        assertThatThrownBy(() -> codecAt(ISSUED_AT).open("garbage")).isInstanceOf(InvalidFlowStateException.class);
    }

    @Test
    void incompleteStateIsRejected() {
        String sealed = codecAt(ISSUED_AT).seal(new OidcFlowState("csrf", null, "verifier", ISSUED_AT));

        assertThatThrownBy(() -> codecAt(ISSUED_AT).open(sealed))
                .isInstanceOf(InvalidFlowStateException.class)
                .hasMessage("Flow cookie is incomplete");
    }

    private OidcFlowCodec codecAt(Instant instant) {
        return new OidcFlowCodec(properties, objectMapper, Clock.fixed(instant, ZoneOffset.UTC));
    }
}
