package com.plaetzchen.community.domain.listing;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ServiceReview(@NotNull Boolean approve, @Size(max = 1000) String adminNotes) {}
