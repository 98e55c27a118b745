package com.plaetzchen.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Random opaque tokens (refresh, email verification, password reset) and their storage hash.
 * <p>
 * Only {@link #hash(String)} of a token is persisted; the raw value is handed to the client
 * once and never stored.
 */
public final class OpaqueTokens {

    private static final int TOKEN_BYTES = 64;
    private static final SecureRandom RANDOM = new SecureRandom();

    private OpaqueTokens() {
        // utility class
    }

    /** Generates a URL-safe random token (Base64url, no padding). */
    public static String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /** SHA-256 of the token as lowercase hex. */
    public static String hash(String token) {
        if (token == null) {
            throw new IllegalArgumentException("token must not be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
