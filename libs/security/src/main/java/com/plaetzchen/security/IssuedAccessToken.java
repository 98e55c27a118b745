package com.plaetzchen.security;

import java.time.Instant;

/**
 * A freshly signed access token.
 *
 * @param token     compact JWT
 * @param expiresAt expiry instant
 * @param expiresIn lifetime in seconds, as reported to the client
 */
public record IssuedAccessToken(String token, Instant expiresAt, long expiresIn) {
}
