package com.plaetzchen.community.domain.event;

import com.plaetzchen.community.domain.user.UserSummary;
import java.time.Instant;

/** Event as shown in listings. {@code participantCount} counts registered members only. */
public record EventView(
        long id,
        String title,
        String description,
        Instant startDatetime,
        Instant endDatetime,
        String location,
        Integer maxParticipants,
        boolean isActive,
        Instant createdAt,
        UserSummary creator,
        long categoryId,
        String categoryName,
        long participantCount) {

    static EventView of(
            CommunityEvent e, UserSummary creator, String categoryName, long participantCount) {
        return new EventView(
                e.getId(),
                e.getTitle(),
                e.getDescription(),
                e.getStartDatetime(),
                e.getEndDatetime(),
                e.getLocation(),
                e.getMaxParticipants(),
                e.isActive(),
                e.getCreatedAt(),
                creator,
                e.getCategoryId(),
                categoryName,
                participantCount);
    }
}
