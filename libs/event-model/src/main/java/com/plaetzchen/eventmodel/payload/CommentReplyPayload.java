package com.plaetzchen.eventmodel.payload;

/**
 * Payload of {@code comment_reply}. Exactly one of {@code eventId} and {@code serviceId} is set.
 */
public record CommentReplyPayload(
        long commentId,
        long parentId,
        Long eventId,
        Long serviceId,
        String contentPreview,
        ActorSummary actor
) {
}
