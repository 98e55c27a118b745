package com.plaetzchen.community.domain.notification;

import java.util.List;
import java.util.Map;

public record NotificationStatsView(
        long totalUnread, Map<String, Long> unreadByType, List<NotificationView> latestNotifications) {}
