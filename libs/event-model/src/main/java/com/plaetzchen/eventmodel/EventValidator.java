package com.plaetzchen.eventmodel;

import java.util.ArrayList;

/**
 * Validates {@link EventEnvelope} instances for required fields and format.
 *
 * <p>WHY manual validation over Bean Validation: no annotation-processing dependency, returns all
 * errors at once in a {@link ValidationResult}, and is fast.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    public static ValidationResult validate(EventEnvelope<?> event) {
        var errors = new ArrayList<String>();

        if (isBlank(event.eventId())) {
            errors.add("eventId must not be null or blank");
        }
        if (isBlank(event.eventType())) {
            errors.add("eventType must not be null or blank");
        } else if (!EventType.isKnown(event.eventType())) {
            errors.add("eventType '" + event.eventType() + "' is not a known event type");
        }
        if (event.eventVersion() < 1) {
            errors.add("eventVersion must be >= 1");
        }
        if (event.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }
        if (isBlank(event.producer())) {
            errors.add("producer must not be null or blank");
        }
        if (event.recipientId() == null) {
            errors.add("recipientId must not be null");
        }
        if (event.entity() == null) {
            errors.add("entity must not be null");
        } else if (isBlank(event.entity().entityId())) {
            errors.add("entity.entityId must not be null or blank");
        }
        if (event.payload() == null) {
            errors.add("payload must not be null");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
