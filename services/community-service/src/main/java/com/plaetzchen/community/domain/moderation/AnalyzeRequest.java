package com.plaetzchen.community.domain.moderation;

import jakarta.validation.constraints.NotNull;

public record AnalyzeRequest(@NotNull String content) {}
