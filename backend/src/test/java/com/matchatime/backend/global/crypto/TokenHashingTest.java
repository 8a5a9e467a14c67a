package com.matchatime.backend.global.crypto;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TokenHashingTest {

    @Test
    void sha256HexMatchesKnownDigest() {
        assertThat(TokenHashing.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void constantTimeEqualsHandlesNullsAndLengths() {
        assertThat(TokenHashing.constantTimeEquals("state", "state")).isTrue();
        assertThat(TokenHashing.constantTimeEquals("state", "stat")).isFalse();
        assertThat(TokenHashing.constantTimeEquals("state", null)).isFalse();
        assertThat(TokenHashing.constantTimeEquals(null, "state")).isFalse();
    }

    @Test
    void newTokensAreHexAndUnique() {
        String first = SecureTokens.newTokenHex(32);
        String second = SecureTokens.newTokenHex(32);

        assertThat(first).hasSize(64).matches("[0-9a-f]+");
        assertThat(first).isNotEqualTo(second);
        assertThat(SecureTokens.newTokenBase64Url(32)).matches("[A-Za-z0-9_-]{43}");
    }
}
