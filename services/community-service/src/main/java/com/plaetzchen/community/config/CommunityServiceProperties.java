package com.plaetzchen.community.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the community service itself.
 *
 * <p>WHY: Spring Boot binds YAML/env properties to this record at startup and validates them via
 * Bean Validation. Invalid config means fail-fast with a clear error message instead of a
 * half-configured service.
 *
 * <pre>
 * plaetzchen:
 *   service:
 *     name: community-service
 *     environment: production
 *     description: Plaetzchen community platform API
 *     cors-allowed-origins:
 *       - https://plaetzchen.example
 * </pre>
 *
 * @param name Service name used for logging and metrics. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param description Human-readable description returned by the info endpoint.
 * @param corsAllowedOrigins Browser origins allowed to call {@code /api/**}.
 */
@ConfigurationProperties(prefix = "plaetzchen.service")
@Validated
public record CommunityServiceProperties(
        @NotBlank String name,
        String environment,
        String description,
        List<String> corsAllowedOrigins) {

    /**
     * Applies defaults for optional fields. Runs before Bean Validation, so defaults satisfy the
     * constraints.
     */
    public CommunityServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (corsAllowedOrigins == null || corsAllowedOrigins.isEmpty()) {
            corsAllowedOrigins = List.of("http://localhost:3000");
        } else {
            corsAllowedOrigins = List.copyOf(corsAllowedOrigins);
        }
    }
}
