package com.plaetzchen.eventmodel;

import java.util.Optional;

/**
 * All community event types.
 *
 * <p>WHY an enum: compile-time safety and one place to add new types. The {@code value} is the
 * canonical string used in envelopes and as the notification type shown to clients.
 */
public enum EventType {

    // ---- Forum ----
    FORUM_REPLY("forum_reply"),
    FORUM_MENTION("forum_mention"),
    FORUM_QUOTE("forum_quote"),

    // ---- Events ----
    EVENT_PARTICIPANT_JOINED("event_participant_joined"),

    // ---- Comments ----
    COMMENT_REPLY("comment_reply");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g. "forum_reply"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an EventType by its canonical string value.
     *
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
