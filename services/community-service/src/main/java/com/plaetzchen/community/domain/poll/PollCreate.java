package com.plaetzchen.community.domain.poll;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;

/**
 * New poll. {@code threadId} is required for thread polls and forbidden for admin polls; without
 * {@code endsAt} the suggested duration applies.
 */
public record PollCreate(
        @NotBlank @Size(max = 500) String question,
        @NotNull PollType pollType,
        Long threadId,
        @NotNull List<@NotBlank @Size(max = 200) String> options,
        Instant endsAt,
        @Positive Integer expectedParticipants) {}
