package com.plaetzchen.community.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables {@code @Scheduled} processing for the maintenance jobs (auto-attendance, expired token
 * cleanup). Switched off with {@code plaetzchen.events.scheduler-enabled=false}, which the test
 * profile does so jobs never race with test transactions.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(
        prefix = "plaetzchen.events",
        name = "scheduler-enabled",
        havingValue = "true",
        matchIfMissing = true)
public class SchedulingConfig {}
