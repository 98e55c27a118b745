package com.plaetzchen.community.domain.event;

import java.time.Instant;

public record EventCategoryView(long id, String name, String description, Instant createdAt) {

    public static EventCategoryView of(EventCategory c) {
        return new EventCategoryView(c.getId(), c.getName(), c.getDescription(), c.getCreatedAt());
    }
}
