package com.plaetzchen.community.domain.poll;

import jakarta.validation.constraints.NotNull;

public record VoteRequest(@NotNull Long optionId) {}
