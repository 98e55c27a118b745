package com.plaetzchen.community.domain.event;

import com.plaetzchen.community.domain.user.UserSummary;
import java.time.Instant;

public record ParticipantView(UserSummary user, ParticipationStatus status, Instant registeredAt) {}
