package com.plaetzchen.eventmodel;

/** Entity kinds that community events can relate to. */
public enum EntityType {
    FORUM_THREAD("ForumThread"),
    FORUM_POST("ForumPost"),
    EVENT("Event"),
    COMMENT("Comment");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    /** Canonical string representation. */
    public String value() {
        return value;
    }
}
