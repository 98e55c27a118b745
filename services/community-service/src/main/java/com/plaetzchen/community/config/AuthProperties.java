package com.plaetzchen.community.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token lifetimes and the JWT signing secret, bound from {@code plaetzchen.auth.*}.
 *
 * @param jwtSecret HS256 secret, at least 32 bytes. Required; never logged.
 * @param issuer {@code iss} claim of issued access tokens.
 * @param accessTokenTtl access token lifetime (default 30 minutes).
 * @param refreshTokenTtl refresh token lifetime (default 30 days).
 * @param verificationTokenTtl email verification token lifetime (default 24 hours).
 * @param passwordResetTokenTtl password reset token lifetime (default 1 hour).
 */
@ConfigurationProperties(prefix = "plaetzchen.auth")
@Validated
public record AuthProperties(
        @NotBlank String jwtSecret,
        String issuer,
        Duration accessTokenTtl,
        Duration refreshTokenTtl,
        Duration verificationTokenTtl,
        Duration passwordResetTokenTtl) {

    public AuthProperties {
        if (issuer == null || issuer.isBlank()) {
            issuer = "plaetzchen";
        }
        if (accessTokenTtl == null) {
            accessTokenTtl = Duration.ofMinutes(30);
        }
        if (refreshTokenTtl == null) {
            refreshTokenTtl = Duration.ofDays(30);
        }
        if (verificationTokenTtl == null) {
            verificationTokenTtl = Duration.ofHours(24);
        }
        if (passwordResetTokenTtl == null) {
            passwordResetTokenTtl = Duration.ofHours(1);
        }
    }
}
