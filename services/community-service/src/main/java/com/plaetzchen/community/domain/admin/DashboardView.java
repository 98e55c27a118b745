package com.plaetzchen.community.domain.admin;

import java.time.Instant;

/** Platform-wide counts for the admin dashboard. */
public record DashboardView(
        Users users,
        Events events,
        Services services,
        Forum forum,
        Polls polls,
        Comments comments,
        Notifications notifications,
        Instant generatedAt) {

    public record Users(long total, long active, long verified, long admins, long newLast7Days) {}

    public record Events(long active, long upcoming, long totalParticipations) {}

    public record Services(long active, long offered, long requested, long pendingReview) {}

    public record Forum(long categories, long threads, long posts) {}

    public record Polls(long active, long totalVotes) {}

    public record Comments(long total) {}

    public record Notifications(long totalUnread) {}
}
