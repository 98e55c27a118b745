package com.plaetzchen.community.domain.poll;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;

/** Partial poll update. Options can only be replaced before the first vote. */
public record PollUpdate(
        @Size(min = 1, max = 500) String question,
        Instant endsAt,
        Boolean isActive,
        List<@NotBlank @Size(max = 200) String> options) {}
