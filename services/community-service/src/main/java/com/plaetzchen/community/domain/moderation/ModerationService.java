package com.plaetzchen.community.domain.moderation;

import com.plaetzchen.community.domain.comment.Comment;
import com.plaetzchen.community.domain.comment.CommentRepository;
import com.plaetzchen.community.domain.common.ResourceNotFoundException;
import com.plaetzchen.community.domain.forum.ForumPost;
import com.plaetzchen.community.domain.forum.ForumPostRepository;
import com.plaetzchen.community.domain.user.UserRepository;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Admin-side moderation reports built on {@link ContentModerator}. */
@Service
public class ModerationService {

    private static final Logger log = LoggerFactory.getLogger(ModerationService.class);

    static final int RECENT_COMMENTS = 50;
    static final int RECENT_POSTS = 20;
    static final int FLAGGED_ITEMS_FOR_REVIEW = 3;
    static final double CONFIDENCE_FOR_REVIEW = 0.5;

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final ContentModerator moderator;
    private final CommentRepository comments;
    private final ForumPostRepository posts;
    private final UserRepository users;

    public ModerationService(
            ContentModerator moderator,
            CommentRepository comments,
            ForumPostRepository posts,
            UserRepository users) {
        this.moderator = moderator;
        this.comments = comments;
        this.posts = posts;
        this.users = users;
    }

    public ModerationResult analyze(String content) {
        return moderator.analyze(content);
    }

    @Transactional(readOnly = true)
    public UserModerationReport reportFor(long userId) {
        if (!users.existsById(userId)) {
            throw new ResourceNotFoundException("User not found");
        }
        List<Comment> recentComments =
                comments.findByAuthorId(userId, PageRequest.of(0, RECENT_COMMENTS, NEWEST_FIRST));
        List<ForumPost> recentPosts =
                posts.findByAuthorId(userId, PageRequest.of(0, RECENT_POSTS, NEWEST_FIRST));

        List<UserModerationReport.FlaggedItem> flagged = new ArrayList<>();
        double confidenceSum = 0;
        for (Comment c : recentComments) {
            confidenceSum += check("comment", c.getId(), c.getContent(), flagged);
        }
        for (ForumPost p : recentPosts) {
            confidenceSum += check("forum_post", p.getId(), p.getContent(), flagged);
        }

        int checked = recentComments.size() + recentPosts.size();
        double average = checked == 0 ? 0.0 : Math.round(confidenceSum / checked * 100) / 100.0;
        boolean needsReview = flagged.size() > FLAGGED_ITEMS_FOR_REVIEW || average > CONFIDENCE_FOR_REVIEW;
        log.info(
                "Moderation report for user {}: {} items, {} flagged, review={}",
                userId,
                checked,
                flagged.size(),
                needsReview);
        return new UserModerationReport(userId, checked, flagged.size(), average, needsReview, flagged);
    }

    private double check(
            String type, long id, String content, List<UserModerationReport.FlaggedItem> flagged) {
        ModerationResult result = moderator.analyze(content);
        if (result.isFlagged()) {
            flagged.add(
                    new UserModerationReport.FlaggedItem(type, id, result.confidence(), result.reasons()));
        }
        return result.confidence();
    }
}
