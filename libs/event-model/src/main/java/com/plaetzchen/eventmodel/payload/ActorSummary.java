package com.plaetzchen.eventmodel.payload;

/**
 * The member who acted, as shown in a notification.
 */
public record ActorSummary(long id, String displayName) {
}
