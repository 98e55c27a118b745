package com.plaetzchen.community.domain.listing;

import com.plaetzchen.community.domain.user.UserSummary;
import java.math.BigDecimal;
import java.time.Instant;

public record ServiceListingView(
        long id,
        String title,
        String description,
        boolean isOffering,
        boolean isActive,
        ServiceType serviceType,
        String slug,
        int viewCount,
        int interestCount,
        boolean isCompleted,
        Instant completedAt,
        PriceType priceType,
        BigDecimal priceAmount,
        String priceCurrency,
        Integer estimatedDurationHours,
        String contactMethod,
        UserSummary owner,
        Instant createdAt,
        Instant updatedAt,
        Instant flaggedAt,
        String flaggedReason,
        Instant reviewedAt,
        Long reviewedBy,
        String adminNotes) {

    static ServiceListingView of(ServiceListing s, UserSummary owner) {
        return new ServiceListingView(
                s.getId(),
                s.getTitle(),
                s.getDescription(),
                s.isOffering(),
                s.isActive(),
                s.getServiceType(),
                s.getSlug(),
                s.getViewCount(),
                s.getInterestCount(),
                s.isCompleted(),
                s.getCompletedAt(),
                s.getPriceType(),
                s.getPriceAmount(),
                s.getPriceCurrency(),
                s.getEstimatedDurationHours(),
                s.getContactMethod(),
                owner,
                s.getCreatedAt(),
                s.getUpdatedAt(),
                s.getFlaggedAt(),
                s.getFlaggedReason(),
                s.getReviewedAt(),
                s.getReviewedBy(),
                s.getAdminNotes());
    }
}
