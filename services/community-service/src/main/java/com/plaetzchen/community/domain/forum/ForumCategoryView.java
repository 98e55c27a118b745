package com.plaetzchen.community.domain.forum;

import java.time.Instant;

public record ForumCategoryView(
        long id,
        String name,
        String description,
        String color,
        String icon,
        boolean isActive,
        int displayOrder,
        Instant createdAt,
        long threadCount) {

    static ForumCategoryView of(ForumCategory c, long threadCount) {
        return new ForumCategoryView(
                c.getId(),
                c.getName(),
                c.getDescription(),
                c.getColor(),
                c.getIcon(),
                c.isActive(),
                c.getDisplayOrder(),
                c.getCreatedAt(),
                threadCount);
    }
}
