package com.matchatime.backend.global.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM for small client-held payloads such as the federated login flow cookie.
 * Output is {@code base64url(iv || ciphertext || tag)} without padding so it can be used as a cookie value.
 */
public final class AesGcmCipher {

    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    private AesGcmCipher(byte[] rawKey) {
        this.key = new SecretKeySpec(rawKey, "AES");
    }

    /**
     * Derives the 256-bit key as SHA-256 of the configured secret.
     */
    public static AesGcmCipher fromSecret(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Cookie secret must not be empty");
        }
        return new AesGcmCipher(TokenHashing.sha256(secret.getBytes(StandardCharsets.UTF_8)));
    }

    public String encrypt(String plain) {
        try {
            byte[] iv = new byte[IV_BYTES];
            random.nextBytes(iv);

            Cipher c = Cipher.getInstance(TRANSFORMATION);
            c.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] ct = c.doFinal(plain.getBytes(StandardCharsets.UTF_8));

            byte[] out = new byte[iv.length + ct.length];
            System.arraycopy(iv, 0, out, 0, iv.length);
            System.arraycopy(ct, 0, out, iv.length, ct.length);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(out);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("CRYPTO_ENCRYPT_FAILED", e);
        }
    }

    /**
     * @throws CipherTextException when the payload is malformed or fails authentication
     */
    public String decrypt(String encoded) {
        byte[] all;
        try {
            all = Base64.getUrlDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new CipherTextException("CRYPTO_BAD_ENCODING", e);
        }
        if (all.length <= IV_BYTES) {
            throw new CipherTextException("CRYPTO_BAD_CIPHER", null);
        }
        try {
            Cipher c = Cipher.getInstance(TRANSFORMATION);
            c.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, all, 0, IV_BYTES));
            byte[] pt = c.doFinal(all, IV_BYTES, all.length - IV_BYTES);
            return new String(pt, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new CipherTextException("CRYPTO_DECRYPT_FAILED", e);
        }
    }

    public static class CipherTextException extends RuntimeException {
        public CipherTextException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
