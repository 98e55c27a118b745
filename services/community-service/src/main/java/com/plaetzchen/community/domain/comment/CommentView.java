package com.plaetzchen.community.domain.comment;

import com.plaetzchen.community.domain.user.UserSummary;
import java.time.Instant;
import java.util.List;

/**
 * A comment with its direct replies. Replies of replies are nested the same way.
 */
public record CommentView(
        long id,
        String content,
        Instant createdAt,
        UserSummary author,
        Long parentId,
        Long eventId,
        Long serviceId,
        List<CommentView> replies) {

    static CommentView of(Comment c, UserSummary author, List<CommentView> replies) {
        return new CommentView(
                c.getId(),
                c.getContent(),
                c.getCreatedAt(),
                author,
                c.getParentId(),
                c.getEventId(),
                c.getServiceId(),
                replies);
    }
}
