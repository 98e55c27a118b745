package com.plaetzchen.community.domain.notification;

import com.plaetzchen.community.domain.common.OffsetLimit;
import com.plaetzchen.community.domain.common.ResourceNotFoundException;
import com.plaetzchen.security.AccessDeniedException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** A member's notification inbox. Every operation is scoped to the calling member. */
@Service
public class NotificationService {

    private static final Sort NEWEST_FIRST =
            Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final NotificationRepository notifications;

    public NotificationService(NotificationRepository notifications) {
        this.notifications = notifications;
    }

    @Transactional(readOnly = true)
    public List<NotificationView> list(
            long userId, boolean unreadOnly, String type, int skip, int limit) {
        Specification<Notification> spec =
                (root, query, cb) -> cb.equal(root.get("userId"), userId);
        if (unreadOnly) {
            spec = spec.and((root, query, cb) -> cb.isFalse(root.get("read")));
        }
        if (type != null && !type.isBlank()) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("type"), type));
        }
        return notifications.findAll(spec, OffsetLimit.of(skip, limit, NEWEST_FIRST)).stream()
                .map(NotificationView::of)
                .toList();
    }

    @Transactional(readOnly = true)
    public NotificationStatsView stats(long userId) {
        Map<String, Long> byType = new LinkedHashMap<>();
        for (Object[] row : notifications.countUnreadByType(userId)) {
            byType.put((String) row[0], ((Number) row[1]).longValue());
        }
        List<NotificationView> latest =
                notifications.findTop5ByUserIdOrderByCreatedAtDescIdDesc(userId).stream()
                        .map(NotificationView::of)
                        .toList();
        return new NotificationStatsView(
                notifications.countByUserIdAndReadFalse(userId), byType, latest);
    }

    @Transactional
    public NotificationView markRead(long userId, long notificationId, boolean read) {
        Notification notification = owned(userId, notificationId);
        notification.setRead(read);
        return NotificationView.of(notification);
    }

    @Transactional
    public int markAllRead(long userId) {
        return notifications.markAllRead(userId);
    }

    @Transactional
    public void delete(long userId, long notificationId) {
        notifications.delete(owned(userId, notificationId));
    }

    @Transactional
    public int deleteRead(long userId) {
        return notifications.deleteRead(userId);
    }

    private Notification owned(long userId, long notificationId) {
        Notification notification =
                notifications
                        .findById(notificationId)
                        .orElseThrow(() -> new ResourceNotFoundException("Notification not found"));
        if (!notification.getUserId().equals(userId)) {
            throw new AccessDeniedException("Not authorized to access this notification");
        }
        return notification;
    }
}
