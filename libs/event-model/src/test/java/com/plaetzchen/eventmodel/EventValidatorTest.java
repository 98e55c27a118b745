package com.plaetzchen.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * WHY: an invalid envelope must never turn into a notification row, so the validator has to
 * catch every missing field and report all of them at once.
 */
@DisplayName("EventValidator")
class EventValidatorTest {

    private static final EventEntity ENTITY = EventEntity.of(EntityType.FORUM_POST, 5L);

    @Nested
    @DisplayName("valid events")
    class ValidEvents {

        @Test
        @DisplayName("factory-created event passes validation")
        void factoryEventValid() {
            var event = EventFactory.create(EventType.FORUM_REPLY, "forum-service", 1L, 2L, ENTITY, "data");

            var result = EventValidator.validate(event);

            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
        }
    }

    @Nested
    @DisplayName("invalid events")
    class InvalidEvents {

        @Test
        @DisplayName("unknown event type fails")
        void unknownType() {
            var event = new EventEnvelope<>("id", "TradeExecuted", 1, Instant.now(), "p", "c", 1L, 2L, ENTITY, "x");

            var result = EventValidator.validate(event);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).anyMatch(e -> e.contains("not a known event type"));
        }

        @Test
        @DisplayName("missing recipient fails")
        void missingRecipient() {
            var event = new EventEnvelope<>("id", "forum_reply", 1, Instant.now(), "p", "c", 1L, null, ENTITY, "x");

            assertThat(EventValidator.validate(event).errors()).containsExactly("recipientId must not be null");
        }

        @Test
        @DisplayName("reports all errors at once")
        void reportsAllErrors() {
            var event = new EventEnvelope<>(null, "  ", 0, null, "", null, null, null,
                    new EventEntity("Event", " "), null);

            var result = EventValidator.validate(event);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).hasSize(8);
        }
    }
}
