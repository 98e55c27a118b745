package com.plaetzchen.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;

import com.plaetzchen.eventmodel.payload.ActorSummary;
import com.plaetzchen.eventmodel.payload.EventJoinPayload;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventFactory")
class EventFactoryTest {

    private static final EventJoinPayload PAYLOAD =
            new EventJoinPayload(10L, "Repair cafe", new ActorSummary(2L, "anna"));

    @Test
    @DisplayName("fills id, version and timestamp from the clock")
    void fillsDefaults() {
        Clock clock = Clock.fixed(Instant.parse("2025-05-01T12:00:00Z"), ZoneOffset.UTC);

        var event = EventFactory.create(EventType.EVENT_PARTICIPANT_JOINED, "event-service",
                "corr-1", 2L, 1L, EventEntity.of(EntityType.EVENT, 10L), PAYLOAD, clock);

        assertThat(event.eventId()).isNotBlank();
        assertThat(event.eventType()).isEqualTo("event_participant_joined");
        assertThat(event.eventVersion()).isEqualTo(1);
        assertThat(event.occurredAt()).isEqualTo(Instant.parse("2025-05-01T12:00:00Z"));
        assertThat(event.correlationId()).isEqualTo("corr-1");
        assertThat(event.actorId()).isEqualTo(2L);
        assertThat(event.recipientId()).isEqualTo(1L);
        assertThat(event.entity()).isEqualTo(new EventEntity("Event", "10"));
    }

    @Test
    @DisplayName("generates a correlation id when none is given")
    void generatesCorrelationId() {
        var event = EventFactory.create(EventType.EVENT_PARTICIPANT_JOINED, "event-service",
                2L, 1L, EventEntity.of(EntityType.EVENT, 10L), PAYLOAD);

        assertThat(event.correlationId()).isNotBlank();
    }

    @Test
    @DisplayName("each envelope gets its own event id")
    void uniqueEventIds() {
        var first = EventFactory.create(EventType.FORUM_REPLY, "p", 1L, 2L,
                EventEntity.of(EntityType.FORUM_POST, 1L), PAYLOAD);
        var second = EventFactory.create(EventType.FORUM_REPLY, "p", 1L, 2L,
                EventEntity.of(EntityType.FORUM_POST, 1L), PAYLOAD);

        assertThat(first.eventId()).isNotEqualTo(second.eventId());
    }
}
