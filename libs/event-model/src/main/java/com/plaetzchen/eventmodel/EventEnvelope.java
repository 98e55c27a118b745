package com.plaetzchen.eventmodel;

import java.time.Instant;

/**
 * Envelope for every community domain event.
 *
 * <p>Domain services publish envelopes when something happens that a member should hear about: a
 * reply in their thread, a mention, a new participant at their event. The envelope carries the
 * standard metadata (identification, correlation, who acted and who is addressed) next to the
 * event-specific payload.
 *
 * <p>Envelopes are immutable once created.
 *
 * @param <T> the type of the event-specific payload
 */
public record EventEnvelope<T>(
        /** Unique identifier for this event instance (UUID v4). */
        String eventId,

        /** Canonical {@link EventType} value, e.g. "forum_reply". */
        String eventType,

        /** Schema version of this event type, starting at 1. */
        int eventVersion,

        /** When the event occurred. */
        Instant occurredAt,

        /** Name of the component that produced this event. */
        String producer,

        /** Correlation ID of the request that caused this event. */
        String correlationId,

        /** Member whose action caused the event. */
        Long actorId,

        /** Member the event is addressed to. */
        Long recipientId,

        /** The domain entity this event relates to. */
        EventEntity entity,

        /** Event-specific data. */
        T payload) {}
