package com.plaetzchen.community.domain.notification;

import com.plaetzchen.community.domain.user.User;
import com.plaetzchen.community.domain.user.UserRepository;
import com.plaetzchen.eventmodel.EventEnvelope;
import com.plaetzchen.eventmodel.EventSerializer;
import com.plaetzchen.eventmodel.EventType;
import com.plaetzchen.observability.MetricFactory;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Turns published domain events into notification rows.
 *
 * <p>Nothing is stored when the member would notify themselves, when the recipient is gone or
 * deactivated, or when they switched this notification type off.
 */
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    static final String METRIC_CREATED = "community.notifications.created";

    private final NotificationRepository notifications;
    private final UserRepository users;
    private final MetricFactory metrics;

    public NotificationDispatcher(
            NotificationRepository notifications, UserRepository users, MetricFactory metrics) {
        this.notifications = notifications;
        this.users = users;
        this.metrics = metrics;
    }

    @EventListener
    public void onDomainEvent(EventEnvelope<?> envelope) {
        Optional<EventType> type = EventType.fromString(envelope.eventType());
        if (type.isEmpty() || envelope.recipientId() == null) {
            log.warn("Dropping undeliverable event {} of type {}", envelope.eventId(), envelope.eventType());
            return;
        }
        if (envelope.recipientId().equals(envelope.actorId())) {
            return;
        }
        Optional<User> recipient = users.findById(envelope.recipientId()).filter(User::isActive);
        if (recipient.isEmpty()) {
            log.debug("Recipient {} missing or inactive, skipping {}", envelope.recipientId(), envelope.eventType());
            return;
        }
        if (!recipient.get().wantsNotification(type.get())) {
            log.debug("User {} opted out of {}", envelope.recipientId(), envelope.eventType());
            return;
        }
        notifications.save(
                new Notification(
                        envelope.recipientId(),
                        type.get().value(),
                        EventSerializer.serializePayload(envelope.payload()),
                        envelope.occurredAt()));
        metrics.increment(
                METRIC_CREATED, "In-app notifications created", "type", type.get().value());
        log.info("Notified user {} of {}", envelope.recipientId(), envelope.eventType());
    }
}
