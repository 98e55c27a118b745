package com.plaetzchen.community.domain.event;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record EventCategoryRequest(
        @NotBlank @Size(max = 100) String name, @Size(max = 500) String description) {}
