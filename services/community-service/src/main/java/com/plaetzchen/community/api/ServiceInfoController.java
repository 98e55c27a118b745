package com.plaetzchen.community.api;

import com.plaetzchen.community.config.CommunityServiceProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight operational endpoints.
 *
 * <p>WHY: load balancers and the frontend poll {@code /health} often; it answers from
 * configuration alone and never touches the database. {@code /actuator/health} remains the deep
 * check.
 */
@RestController
public class ServiceInfoController {

    private final CommunityServiceProperties properties;
    private final Clock clock;

    public ServiceInfoController(CommunityServiceProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping("/api/v1/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "status", "running",
                "timestamp", Instant.now(clock).toString());
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "healthy",
                "service", properties.name(),
                "timestamp", Instant.now(clock).toString());
    }
}
