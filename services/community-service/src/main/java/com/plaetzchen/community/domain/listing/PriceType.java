package com.plaetzchen.community.domain.listing;

public enum PriceType {
    FREE,
    FIXED,
    HOURLY,
    NEGOTIABLE,
    EXCHANGE
}
