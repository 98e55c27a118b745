package com.plaetzchen.community.infrastructure.scheduling;

import com.plaetzchen.community.domain.auth.AuthService;
import com.plaetzchen.community.domain.auth.TokenPurgeResult;
import com.plaetzchen.community.domain.event.EventService;
import com.plaetzchen.observability.CorrelationContext;
import com.plaetzchen.observability.CorrelationContextHolder;
import com.plaetzchen.observability.MetricFactory;
import com.plaetzchen.observability.SpanHelper;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic housekeeping: auto-attendance for ended events and removal of expired tokens.
 *
 * <p>Each run gets its own correlation ID so its log lines can be grouped like a request's.
 */
@Component
@ConditionalOnProperty(
        prefix = "plaetzchen.events",
        name = "scheduler-enabled",
        havingValue = "true",
        matchIfMissing = true)
public class MaintenanceJobs {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceJobs.class);

    static final String METRIC_JOB_DURATION = "community.jobs.duration";

    private final EventService eventService;
    private final AuthService authService;
    private final MetricFactory metrics;
    private final SpanHelper spans;

    public MaintenanceJobs(
            EventService eventService, AuthService authService, MetricFactory metrics, SpanHelper spans) {
        this.eventService = eventService;
        this.authService = authService;
        this.metrics = metrics;
        this.spans = spans;
    }

    @Scheduled(cron = "${plaetzchen.events.completion-cron:0 0 * * * *}")
    public void completeEndedEvents() {
        runJob(
                "event-completion",
                () -> {
                    int processed = eventService.processCompletedEvents();
                    log.info("Auto-attendance processed {} ended events", processed);
                });
    }

    @Scheduled(cron = "${plaetzchen.auth.token-purge-cron:0 30 3 * * *}")
    public void purgeExpiredTokens() {
        runJob(
                "token-purge",
                () -> {
                    TokenPurgeResult result = authService.purgeExpiredTokens();
                    log.debug("Token purge removed {}", result);
                });
    }

    private void runJob(String job, Runnable body) {
        CorrelationContext context = new CorrelationContext("job-" + UUID.randomUUID(), null, null);
        CorrelationContextHolder.runWithContext(
                context,
                () -> {
                    try {
                        metrics.timer(METRIC_JOB_DURATION, "Maintenance job duration", "job", job)
                                .record(() -> spans.traced("job." + job, Map.of("job", job), body));
                    } catch (RuntimeException e) {
                        log.error("Maintenance job {} failed", job, e);
                    }
                });
    }
}
