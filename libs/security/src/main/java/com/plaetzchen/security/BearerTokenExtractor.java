package com.plaetzchen.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP Authorization headers.
 * <p>
 * WHY a utility class: parsing "Bearer xxx" looks trivial but is easy to get subtly wrong
 * (case, whitespace, empty token), so it lives in one place.
 */
public final class BearerTokenExtractor {

    private static final String PREFIX = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the bearer token from an Authorization header value.
     *
     * @param authorizationHeader the full header value (may be null)
     * @return the token, or empty if the header is missing or malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith(PREFIX)) {
            return Optional.empty();
        }
        String token = trimmed.substring(PREFIX.length());
        // "Bearertoken" is not a bearer header
        if (!token.isEmpty() && !Character.isWhitespace(token.charAt(0))) {
            return Optional.empty();
        }
        token = token.strip();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
