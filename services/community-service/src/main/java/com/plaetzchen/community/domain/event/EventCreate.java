package com.plaetzchen.community.domain.event;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Instant;

public record EventCreate(
        @NotBlank @Size(max = 100) String title,
        @Size(max = 5000) String description,
        @NotNull Instant startDatetime,
        @NotNull Instant endDatetime,
        @Size(max = 200) String location,
        @Positive Integer maxParticipants,
        @NotNull Long categoryId) {}
