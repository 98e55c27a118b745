package com.plaetzchen.community.domain.notification;

import jakarta.validation.constraints.NotNull;

public record ReadUpdate(@NotNull Boolean isRead) {}
