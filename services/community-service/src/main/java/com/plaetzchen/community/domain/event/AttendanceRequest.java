package com.plaetzchen.community.domain.event;

import jakarta.validation.constraints.NotNull;
import java.util.List;

public record AttendanceRequest(@NotNull List<Long> userIds) {}
