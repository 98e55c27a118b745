package com.plaetzchen.community.domain.user;

import jakarta.validation.constraints.NotNull;

public record AdminRoleUpdate(@NotNull Boolean isAdmin) {}
