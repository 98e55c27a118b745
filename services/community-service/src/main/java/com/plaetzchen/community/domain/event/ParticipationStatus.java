package com.plaetzchen.community.domain.event;

public enum ParticipationStatus {
    REGISTERED,
    ATTENDED,
    CANCELLED
}
