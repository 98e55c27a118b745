package com.plaetzchen.community.domain.listing;

public record ServiceStatsView(long totalActiveServices, long servicesOffered, long servicesRequested) {}
