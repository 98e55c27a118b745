package com.plaetzchen.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Issues and validates HS256-signed access tokens.
 * <p>
 * Claims: {@code sub} (member id), {@code type} ({@value #ACCESS_TYPE}), {@code iss},
 * {@code iat} and {@code exp}. Refresh tokens are deliberately not JWTs: they are opaque,
 * stored hashed, and can be revoked (see {@link OpaqueTokens}).
 */
public class JwtTokenService {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

    public static final String TYPE_CLAIM = "type";
    public static final String ACCESS_TYPE = "access";

    /** HS256 needs a key of at least 256 bits. */
    public static final int MIN_SECRET_BYTES = 32;

    private final SecretKey key;
    private final String issuer;
    private final Duration accessTokenTtl;
    private final Clock clock;

    public JwtTokenService(String secret, String issuer, Duration accessTokenTtl, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "JWT secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (accessTokenTtl == null || accessTokenTtl.isNegative() || accessTokenTtl.isZero()) {
            throw new IllegalArgumentException("accessTokenTtl must be positive");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.issuer = issuer;
        this.accessTokenTtl = accessTokenTtl;
        this.clock = clock;
    }

    /**
     * Signs a new access token for the member.
     */
    public IssuedAccessToken issueAccessToken(long userId) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(accessTokenTtl);
        String token = Jwts.builder()
                .subject(Long.toString(userId))
                .issuer(issuer)
                .claim(TYPE_CLAIM, ACCESS_TYPE)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
        return new IssuedAccessToken(token, expiresAt, accessTokenTtl.toSeconds());
    }

    /**
     * Validates an access token and returns the member id it was issued for.
     *
     * @return the member id, or empty when the token is malformed, tampered with, expired,
     *         from another issuer or not an access token
     */
    public Optional<Long> parseAccessToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            if (!ACCESS_TYPE.equals(claims.get(TYPE_CLAIM, String.class))) {
                log.debug("Rejected token with type {}", claims.get(TYPE_CLAIM));
                return Optional.empty();
            }
            return Optional.of(Long.parseLong(claims.getSubject()));
        } catch (JwtException | IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException
            log.debug("Rejected access token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Duration accessTokenTtl() {
        return accessTokenTtl;
    }
}
