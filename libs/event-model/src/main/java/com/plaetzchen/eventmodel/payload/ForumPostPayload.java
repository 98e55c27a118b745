package com.plaetzchen.eventmodel.payload;

/**
 * Payload of forum reply, mention and quote events.
 *
 * @param threadId       thread the post was written in
 * @param postId         the new post
 * @param threadTitle    thread title at the time of posting
 * @param contentPreview plain-text preview, see {@link ContentPreview}
 * @param actor          author of the new post
 * @param quotedPostId   quoted post (quote events only)
 */
public record ForumPostPayload(
        long threadId,
        long postId,
        String threadTitle,
        String contentPreview,
        ActorSummary actor,
        Long quotedPostId
) {
}
