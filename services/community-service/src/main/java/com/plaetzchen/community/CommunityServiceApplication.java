package com.plaetzchen.community;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Plaetzchen community service: the REST back end behind the neighbourhood platform.
 *
 * <p>WHY one application: members, events, service listings, the forum, polls, comments and
 * notifications share one database and one request lifecycle (correlation ID, bearer
 * authentication, RFC 7807 errors). Splitting them would only add network hops.
 *
 * <p>Key features configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, info and metrics endpoints
 *   <li>Correlation ID propagation and bearer token authentication (servlet filters)
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>Flyway-managed schema from {@code plaetzchen-database}
 *   <li>Hourly auto-attendance and daily token cleanup jobs
 * </ul>
 */
@SpringBootApplication
public class CommunityServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(CommunityServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CommunityServiceApplication.class, args);
        log.info("Plaetzchen community service started successfully");
    }
}
