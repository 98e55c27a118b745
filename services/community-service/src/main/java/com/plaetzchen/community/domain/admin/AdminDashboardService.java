package com.plaetzchen.community.domain.admin;

import com.plaetzchen.community.domain.comment.CommentRepository;
import com.plaetzchen.community.domain.event.CommunityEventRepository;
import com.plaetzchen.community.domain.event.EventParticipationRepository;
import com.plaetzchen.community.domain.forum.ForumCategoryRepository;
import com.plaetzchen.community.domain.forum.ForumPostRepository;
import com.plaetzchen.community.domain.forum.ForumThreadRepository;
import com.plaetzchen.community.domain.listing.ServiceListingRepository;
import com.plaetzchen.community.domain.notification.NotificationRepository;
import com.plaetzchen.community.domain.poll.PollRepository;
import com.plaetzchen.community.domain.poll.PollVoteRepository;
import com.plaetzchen.community.domain.user.UserRepository;
import com.plaetzchen.database.migration.MigrationService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read-only platform statistics for administrators. */
@Service
public class AdminDashboardService {

    static final Duration NEW_USER_WINDOW = Duration.ofDays(7);

    private final UserRepository users;
    private final CommunityEventRepository events;
    private final EventParticipationRepository participations;
    private final ServiceListingRepository listings;
    private final ForumCategoryRepository forumCategories;
    private final ForumThreadRepository threads;
    private final ForumPostRepository posts;
    private final PollRepository polls;
    private final PollVoteRepository votes;
    private final CommentRepository comments;
    private final NotificationRepository notifications;
    private final MigrationService migrationService;
    private final Clock clock;

    public AdminDashboardService(
            UserRepository users,
            CommunityEventRepository events,
            EventParticipationRepository participations,
            ServiceListingRepository listings,
            ForumCategoryRepository forumCategories,
            ForumThreadRepository threads,
            ForumPostRepository posts,
            PollRepository polls,
            PollVoteRepository votes,
            CommentRepository comments,
            NotificationRepository notifications,
            MigrationService migrationService,
            Clock clock) {
        this.users = users;
        this.events = events;
        this.participations = participations;
        this.listings = listings;
        this.forumCategories = forumCategories;
        this.threads = threads;
        this.posts = posts;
        this.polls = polls;
        this.votes = votes;
        this.comments = comments;
        this.notifications = notifications;
        this.migrationService = migrationService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public DashboardView dashboard() {
        Instant now = Instant.now(clock);
        return new DashboardView(
                new DashboardView.Users(
                        users.count(),
                        users.countByActiveTrue(),
                        users.countByEmailVerifiedTrue(),
                        users.countByAdminTrue(),
                        users.countByCreatedAtAfter(now.minus(NEW_USER_WINDOW))),
                new DashboardView.Events(
                        events.countByActiveTrue(),
                        events.countByActiveTrueAndStartDatetimeAfter(now),
                        participations.count()),
                new DashboardView.Services(
                        listings.countByActiveTrue(),
                        listings.countByActiveTrueAndOfferingTrue(),
                        listings.countByActiveTrueAndOfferingFalse(),
                        listings.countByFlaggedAtIsNotNullAndReviewedAtIsNull()),
                new DashboardView.Forum(forumCategories.count(), threads.count(), posts.count()),
                new DashboardView.Polls(polls.countByActiveTrue(), votes.count()),
                new DashboardView.Comments(comments.count()),
                new DashboardView.Notifications(notifications.countByReadFalse()),
                now);
    }

    public MigrationService.DatabaseStatus migrations() {
        return migrationService.status();
    }
}
