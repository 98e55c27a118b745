package com.plaetzchen.community.domain.listing;

public enum ServiceType {
    USER_SERVICE,
    PLATFORM_FEATURE
}
