package com.pixshare.service;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * URL-safe random strings for share tokens and guest keys.
 */
final class Tokens {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private Tokens() {
    }

    /** 24 random bytes, 32 characters. */
    static String newToken() {
        return random(24);
    }

    static String random(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return ENCODER.encodeToString(buffer);
    }
}
