package com.plaetzchen.community.domain.auth;

/**
 * Token pair returned by login and refresh.
 *
 * @param expiresIn access token lifetime in seconds
 */
public record TokenResponse(String accessToken, String refreshToken, String tokenType, long expiresIn) {

    static final String BEARER = "bearer";

    static TokenResponse bearer(String accessToken, String refreshToken, long expiresIn) {
        return new TokenResponse(accessToken, refreshToken, BEARER, expiresIn);
    }
}
