package com.plaetzchen.community.domain.notification;

import com.plaetzchen.eventmodel.EventSerializer;
import java.time.Instant;
import java.util.Map;

public record NotificationView(
        long id, long userId, String type, boolean isRead, Instant createdAt, Map<String, Object> data) {

    static NotificationView of(Notification n) {
        return new NotificationView(
                n.getId(),
                n.getUserId(),
                n.getType(),
                n.isRead(),
                n.getCreatedAt(),
                EventSerializer.readPayload(n.getPayload()));
    }
}
