package com.matchatime.backend.global.crypto;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

public final class SecureTokens {

    private static final SecureRandom SR = new SecureRandom();

    private SecureTokens() {
    }

    public static String newTokenHex(int bytes) {
        return HexFormat.of().formatHex(randomBytes(bytes));
    }

    public static String newTokenBase64Url(int bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes(bytes));
    }

    private static byte[] randomBytes(int bytes) {
        byte[] buf = new byte[bytes];
        SR.nextBytes(buf);
        return buf;
    }
}
