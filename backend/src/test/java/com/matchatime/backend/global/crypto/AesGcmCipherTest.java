package com.matchatime.backend.global.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Base64;

import com.matchatime.backend.global.crypto.AesGcmCipher.CipherTextException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AesGcmCipherTest {

    private final AesGcmCipher cipher = AesGcmCipher.fromSecret("a-cookie-secret-used-only-by-this-test");

    @Test
    @DisplayName("same plaintext encrypts under a fresh IV every time")
    void encryptUsesFreshIv() {
        String first = cipher.encrypt("{\"state\":\"abc\"}");
        String second = cipher.encrypt("{\"state\":\"abc\"}");

        assertThat(first).isNotEqualTo(second);
        assertThat(cipher.decrypt(first)).isEqualTo("{\"state\":\"abc\"}");
        assertThat(first).doesNotContain("=", "+", "/");
    }

    @Test
    void tamperedCiphertextFailsAuthentication() {
        byte[] raw = Base64.getUrlDecoder().decode(cipher.encrypt("payload"));
        raw[raw.length - 1] ^= 0x01;
        String tampered = Base64.getUrlEncoder().withoutPadding().encodeToString(raw);

        assertThatThrownBy(() -> cipher.decrypt(tampered))
                .isInstanceOf(CipherTextException.class)
                .hasMessage("CRYPTO_DECRYPT_FAILED");
    }

    @Test
    void differentSecretCannotDecrypt() {
        String sealed = cipher.encrypt("payload");
        AesGcmCipher other = AesGcmCipher.fromSecret("some-other-secret");

        assertThatThrownBy(() -> other.decrypt(sealed)).isInstanceOf(CipherTextException.class);
    }

    @Test
    void malformedInputIsRejected() {
        assertThatThrownBy(() -> cipher.decrypt("not base64 at all!"))
                .isInstanceOf(CipherTextException.class)
                .hasMessage("CRYPTO_BAD_ENCODING");
        assertThatThrownBy(() -> cipher.decrypt("AAAA"))
                .isInstanceOf(CipherTextException.class)
                .hasMessage("CRYPTO_BAD_CIPHER");
    }

    @Test
    void emptySecretIsRefused() {
        assertThatThrownBy(() -> AesGcmCipher.fromSecret(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
