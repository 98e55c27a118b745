package com.plaetzchen.community.domain.comment;

import com.plaetzchen.community.domain.common.BusinessRuleException;
import com.plaetzchen.community.domain.common.OffsetLimit;
import com.plaetzchen.community.domain.common.ResourceNotFoundException;
import com.plaetzchen.community.domain.event.CommunityEvent;
import com.plaetzchen.community.domain.event.CommunityEventRepository;
import com.plaetzchen.community.domain.listing.ServiceListing;
import com.plaetzchen.community.domain.listing.ServiceListingRepository;
import com.plaetzchen.community.domain.moderation.ContentModerator;
import com.plaetzchen.community.domain.moderation.ModerationResult;
import com.plaetzchen.community.domain.notification.NotificationPublisher;
import com.plaetzchen.community.domain.user.UserLookup;
import com.plaetzchen.community.domain.user.UserSummary;
import com.plaetzchen.eventmodel.EntityType;
import com.plaetzchen.eventmodel.EventEntity;
import com.plaetzchen.eventmodel.EventType;
import com.plaetzchen.eventmodel.payload.ActorSummary;
import com.plaetzchen.eventmodel.payload.CommentReplyPayload;
import com.plaetzchen.eventmodel.payload.ContentPreview;
import com.plaetzchen.security.OwnershipEnforcer;
import com.plaetzchen.security.PlatformSecurityContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Threaded comments on events and service listings.
 *
 * <p>Comments hang off exactly one target. Soft-deleted targets answer 404 for both reading and
 * writing, the same as a missing one.
 */
@Service
public class CommentService {

    private static final Logger log = LoggerFactory.getLogger(CommentService.class);

    static final String TARGET_REQUIRED = "Must specify event_id or service_id";
    static final String NOT_AUTHORIZED = "Not authorized to modify this comment";
    static final String PARENT_ELSEWHERE = "Parent comment must belong to the same event or service";

    private static final Sort OLDEST_FIRST = Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("id"));
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final CommentRepository comments;
    private final CommunityEventRepository events;
    private final ServiceListingRepository listings;
    private final ContentModerator moderator;
    private final NotificationPublisher notificationPublisher;
    private final UserLookup userLookup;
    private final Clock clock;

    public CommentService(
            CommentRepository comments,
            CommunityEventRepository events,
            ServiceListingRepository listings,
            ContentModerator moderator,
            NotificationPublisher notificationPublisher,
            UserLookup userLookup,
            Clock clock) {
        this.comments = comments;
        this.events = events;
        this.listings = listings;
        this.moderator = moderator;
        this.notificationPublisher = notificationPublisher;
        this.userLookup = userLookup;
        this.clock = clock;
    }

    /**
     * Top-level comments of a target with their reply trees, or the direct replies of
     * {@code parentId} when given.
     */
    @Transactional(readOnly = true)
    public List<CommentView> list(Long eventId, Long serviceId, Long parentId, int skip, int limit) {
        requireSingleTarget(eventId, serviceId);
        requireActiveTarget(eventId, serviceId);
        if (parentId != null) {
            requireParent(parentId, eventId, serviceId);
            List<Comment> replies =
                    comments.findByParentIdOrderByCreatedAtAscIdAsc(
                            parentId, OffsetLimit.of(skip, limit, OLDEST_FIRST));
            Map<Long, UserSummary> authors =
                    userLookup.summaries(replies.stream().map(Comment::getAuthorId).toList());
            return replies.stream()
                    .map(c -> CommentView.of(c, UserLookup.from(authors, c.getAuthorId()), List.of()))
                    .toList();
        }

        OffsetLimit.of(skip, limit); // rejects bad paging before loading the tree
        List<Comment> all =
                eventId != null
                        ? comments.findByEventIdOrderByCreatedAtAscIdAsc(eventId)
                        : comments.findByServiceIdOrderByCreatedAtAscIdAsc(serviceId);
        Map<Long, UserSummary> authors =
                userLookup.summaries(all.stream().map(Comment::getAuthorId).distinct().toList());
        Map<Long, List<Comment>> childrenByParent = new HashMap<>();
        List<Comment> roots = new ArrayList<>();
        for (Comment c : all) {
            if (c.getParentId() == null) {
                roots.add(c);
            } else {
                childrenByParent.computeIfAbsent(c.getParentId(), id -> new ArrayList<>()).add(c);
            }
        }
        return roots.stream()
                .skip(skip)
                .limit(limit)
                .map(root -> tree(root, childrenByParent, authors))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<CommentView> writtenBy(long userId, int skip, int limit) {
        List<Comment> page = comments.findByAuthorId(userId, OffsetLimit.of(skip, limit, NEWEST_FIRST));
        UserSummary author = userLookup.summary(userId);
        return page.stream().map(c -> CommentView.of(c, author, List.of())).toList();
    }

    @Transactional
    public CommentView create(PlatformSecurityContext ctx, CommentCreate request) {
        if (request.eventId() != null && request.serviceId() != null) {
            throw new BusinessRuleException("Comment cannot belong to both event and service");
        }
        requireSingleTarget(request.eventId(), request.serviceId());
        requireActiveTarget(request.eventId(), request.serviceId());

        String content = request.content().trim();
        Comment parent = null;
        if (request.parentId() != null) {
            parent = requireParent(request.parentId(), request.eventId(), request.serviceId());
        }
        rejectFlagged(content);

        Comment comment =
                comments.save(
                        new Comment(
                                content,
                                ctx.userId(),
                                parent != null ? parent.getId() : null,
                                request.eventId(),
                                request.serviceId(),
                                Instant.now(clock)));
        log.info("User {} commented {} (parent {})", ctx.userId(), comment.getId(), request.parentId());

        if (parent != null) {
            notificationPublisher.publish(
                    EventType.COMMENT_REPLY,
                    ctx.userId(),
                    parent.getAuthorId(),
                    EventEntity.of(EntityType.COMMENT, comment.getId()),
                    new CommentReplyPayload(
                            comment.getId(),
                            parent.getId(),
                            comment.getEventId(),
                            comment.getServiceId(),
                            ContentPreview.of(content),
                            new ActorSummary(ctx.userId(), ctx.user().displayName())));
        }
        return CommentView.of(comment, userLookup.summary(ctx.userId()), List.of());
    }

    @Transactional
    public CommentView update(PlatformSecurityContext ctx, long commentId, CommentUpdate request) {
        Comment comment = comment(commentId);
        OwnershipEnforcer.enforce(ctx, comment.getAuthorId(), NOT_AUTHORIZED);
        String content = request.content().trim();
        rejectFlagged(content);
        comment.setContent(content);
        return CommentView.of(comment, userLookup.summary(comment.getAuthorId()), List.of());
    }

    /** Deletes the comment; replies go with it through the foreign key cascade. */
    @Transactional
    public void delete(PlatformSecurityContext ctx, long commentId) {
        Comment comment = comment(commentId);
        OwnershipEnforcer.enforce(ctx, comment.getAuthorId(), NOT_AUTHORIZED);
        comments.delete(comment);
        log.info("User {} deleted comment {}", ctx.userId(), commentId);
    }

    private CommentView tree(
            Comment node, Map<Long, List<Comment>> childrenByParent, Map<Long, UserSummary> authors) {
        List<CommentView> replies =
                childrenByParent.getOrDefault(node.getId(), List.of()).stream()
                        .map(child -> tree(child, childrenByParent, authors))
                        .toList();
        return CommentView.of(node, UserLookup.from(authors, node.getAuthorId()), replies);
    }

    /** Loads a parent comment and checks that it hangs off the given target. */
    private Comment requireParent(long parentId, Long eventId, Long serviceId) {
        Comment parent =
                comments.findById(parentId)
                        .orElseThrow(() -> new ResourceNotFoundException("Parent comment not found"));
        boolean sameTarget =
                eventId != null
                        ? Objects.equals(parent.getEventId(), eventId)
                        : Objects.equals(parent.getServiceId(), serviceId);
        if (!sameTarget) {
            throw new BusinessRuleException(PARENT_ELSEWHERE);
        }
        return parent;
    }

    private void rejectFlagged(String content) {
        ModerationResult result = moderator.analyze(content);
        if (result.isFlagged()) {
            throw new BusinessRuleException("Comment rejected by moderation: " + result.summary());
        }
    }

    private static void requireSingleTarget(Long eventId, Long serviceId) {
        if (eventId == null && serviceId == null) {
            throw new BusinessRuleException(TARGET_REQUIRED);
        }
    }

    private void requireActiveTarget(Long eventId, Long serviceId) {
        if (eventId != null) {
            events.findById(eventId)
                    .filter(CommunityEvent::isActive)
                    .orElseThrow(() -> new ResourceNotFoundException("Event not found"));
        } else {
            listings.findById(serviceId)
                    .filter(ServiceListing::isActive)
                    .orElseThrow(() -> new ResourceNotFoundException("Service not found"));
        }
    }

    private Comment comment(long commentId) {
        return comments.findById(commentId)
                .orElseThrow(() -> new ResourceNotFoundException("Comment not found"));
    }
}
