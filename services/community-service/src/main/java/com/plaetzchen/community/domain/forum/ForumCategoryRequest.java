package com.plaetzchen.community.domain.forum;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/** Create or partially update a forum category. {@code name} is required on create. */
public record ForumCategoryRequest(
        @Size(min = 1, max = 100) String name,
        @Size(max = 500) String description,
        @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "must be a hex color like #1a2b3c")
                String color,
        @Size(max = 50) String icon,
        Boolean isActive,
        @Min(0) Integer displayOrder) {}
