package com.plaetzchen.community.domain.event;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/** Partial event update: {@code null} leaves a field unchanged. */
public record EventUpdate(
        @Size(min = 1, max = 100) String title,
        @Size(max = 5000) String description,
        Instant startDatetime,
        Instant endDatetime,
        @Size(max = 200) String location,
        @Positive Integer maxParticipants,
        Long categoryId) {}
