package com.plaetzchen.community.domain.forum;

import com.plaetzchen.community.domain.user.UserSummary;
import java.time.Instant;

public record PostView(
        long id,
        String content,
        Instant createdAt,
        Instant updatedAt,
        UserSummary author,
        long threadId,
        Long quotedPostId) {

    static PostView of(ForumPost p, UserSummary author) {
        return new PostView(
                p.getId(),
                p.getContent(),
                p.getCreatedAt(),
                p.getUpdatedAt(),
                author,
                p.getThreadId(),
                p.getQuotedPostId());
    }
}
