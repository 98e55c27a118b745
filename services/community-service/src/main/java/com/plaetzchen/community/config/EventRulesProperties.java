package com.plaetzchen.community.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Event participation rules, bound from {@code plaetzchen.events.*}.
 *
 * @param registrationDeadline how long before the start registration closes (default 24h)
 * @param autoAttendanceDelay how long after the end registered participants are marked attended
 *     (default 1h)
 * @param completionBatchSize events processed per scheduler run (default 10)
 * @param schedulerEnabled whether the maintenance jobs run (default true)
 */
@ConfigurationProperties(prefix = "plaetzchen.events")
public record EventRulesProperties(
        Duration registrationDeadline,
        Duration autoAttendanceDelay,
        int completionBatchSize,
        Boolean schedulerEnabled) {

    public EventRulesProperties {
        if (registrationDeadline == null) {
            registrationDeadline = Duration.ofHours(24);
        }
        if (autoAttendanceDelay == null) {
            autoAttendanceDelay = Duration.ofHours(1);
        }
        if (completionBatchSize <= 0) {
            completionBatchSize = 10;
        }
        if (schedulerEnabled == null) {
            schedulerEnabled = Boolean.TRUE;
        }
    }

    /** Defaults for every rule. */
    public static EventRulesProperties defaults() {
        return new EventRulesProperties(null, null, 0, null);
    }
}
