package com.plaetzchen.eventmodel.payload;

/**
 * Payload of {@code event_participant_joined}.
 */
public record EventJoinPayload(long eventId, String eventTitle, ActorSummary actor) {
}
