package com.plaetzchen.community.domain.notification;

import com.plaetzchen.community.config.CommunityServiceProperties;
import com.plaetzchen.eventmodel.EventEntity;
import com.plaetzchen.eventmodel.EventEnvelope;
import com.plaetzchen.eventmodel.EventFactory;
import com.plaetzchen.eventmodel.EventType;
import com.plaetzchen.eventmodel.EventValidator;
import com.plaetzchen.eventmodel.ValidationResult;
import com.plaetzchen.observability.CorrelationContextHolder;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes domain events that should reach a member as a notification.
 *
 * <p>WHY envelopes instead of direct inserts: the forum, event and comment services state what
 * happened; {@link NotificationDispatcher} owns recipient checks and preferences. Events are
 * delivered synchronously, so the notification commits or rolls back with the action itself.
 */
@Component
public class NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(NotificationPublisher.class);

    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final String producer;

    public NotificationPublisher(
            ApplicationEventPublisher publisher, Clock clock, CommunityServiceProperties service) {
        this.publisher = publisher;
        this.clock = clock;
        this.producer = service.name();
    }

    /**
     * @throws IllegalStateException if the envelope is malformed (a programming error)
     */
    public <T> void publish(
            EventType type, long actorId, long recipientId, EventEntity entity, T payload) {
        EventEnvelope<T> envelope =
                EventFactory.create(
                        type,
                        producer,
                        CorrelationContextHolder.currentCorrelationId(),
                        actorId,
                        recipientId,
                        entity,
                        payload,
                        clock);
        ValidationResult validation = EventValidator.validate(envelope);
        if (!validation.valid()) {
            throw new IllegalStateException("Invalid domain event: " + validation.errors());
        }
        log.debug(
                "Publishing {} for user {} about {} {}",
                envelope.eventType(),
                recipientId,
                entity.entityType(),
                entity.entityId());
        publisher.publishEvent(envelope);
    }
}
