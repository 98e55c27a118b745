package com.plaetzchen.community.domain.event;

import com.plaetzchen.community.domain.user.UserSummary;
import java.time.Instant;

/** Single event with its capacity breakdown. */
public record EventDetailView(
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
        long participantCount,
        boolean isFull,
        EventCapacityView capacity) {

    static EventDetailView of(
            CommunityEvent e, UserSummary creator, String categoryName, long participantCount) {
        EventCapacityView capacity = EventCapacityView.of(e.getMaxParticipants(), participantCount);
        return new EventDetailView(
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
                participantCount,
                capacity.isFull(),
                capacity);
    }
}
