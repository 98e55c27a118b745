package com.plaetzchen.community.domain.forum;

import com.plaetzchen.community.domain.user.UserSummary;
import java.time.Instant;

/** Thread with its post count and most recent post ({@code null} while empty). */
public record ThreadView(
        long id,
        String title,
        boolean isPinned,
        boolean isLocked,
        Instant createdAt,
        UserSummary creator,
        long categoryId,
        long postCount,
        PostView latestPost) {

    static ThreadView of(ForumThread t, UserSummary creator, long postCount, PostView latestPost) {
        return new ThreadView(
                t.getId(),
                t.getTitle(),
                t.isPinned(),
                t.isLocked(),
                t.getCreatedAt(),
                creator,
                t.getCategoryId(),
                postCount,
                latestPost);
    }
}
