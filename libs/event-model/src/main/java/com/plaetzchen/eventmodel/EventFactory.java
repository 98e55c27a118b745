package com.plaetzchen.eventmodel;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for creating {@link EventEnvelope} instances.
 * <p>
 * WHY a factory: encapsulates the defaults (UUID generation, timestamp, version 1) so callers
 * only state what happened and to whom.
 */
public final class EventFactory {

    private EventFactory() {
        // utility class
    }

    /**
     * Creates an envelope with a generated eventId and correlationId, stamped now.
     */
    public static <T> EventEnvelope<T> create(
            EventType eventType,
            String producer,
            Long actorId,
            Long recipientId,
            EventEntity entity,
            T payload
    ) {
        return create(eventType, producer, null, actorId, recipientId, entity, payload, Clock.systemUTC());
    }

    /**
     * Creates an envelope tied to the correlation ID of the current request.
     *
     * @param correlationId correlation ID to carry; a new one is generated when null or blank
     * @param clock         clock used for {@code occurredAt}
     */
    public static <T> EventEnvelope<T> create(
            EventType eventType,
            String producer,
            String correlationId,
            Long actorId,
            Long recipientId,
            EventEntity entity,
            T payload,
            Clock clock
    ) {
        String correlation = correlationId == null || correlationId.isBlank()
                ? UUID.randomUUID().toString()
                : correlationId;
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                eventType.value(),
                1,
                Instant.now(clock),
                producer,
                correlation,
                actorId,
                recipientId,
                entity,
                payload
        );
    }
}
