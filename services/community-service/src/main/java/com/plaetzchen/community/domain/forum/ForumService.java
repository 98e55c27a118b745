package com.plaetzchen.community.domain.forum;

import com.plaetzchen.community.domain.common.BusinessRuleException;
import com.plaetzchen.community.domain.common.OffsetLimit;
import com.plaetzchen.community.domain.common.ResourceNotFoundException;
import com.plaetzchen.community.domain.moderation.ContentModerator;
import com.plaetzchen.community.domain.notification.NotificationPublisher;
import com.plaetzchen.community.domain.user.User;
import com.plaetzchen.community.domain.user.UserLookup;
import com.plaetzchen.community.domain.user.UserRepository;
import com.plaetzchen.community.domain.user.UserSummary;
import com.plaetzchen.eventmodel.EntityType;
import com.plaetzchen.eventmodel.EventEntity;
import com.plaetzchen.eventmodel.EventType;
import com.plaetzchen.eventmodel.payload.ActorSummary;
import com.plaetzchen.eventmodel.payload.ContentPreview;
import com.plaetzchen.eventmodel.payload.ForumPostPayload;
import com.plaetzchen.security.AccessDeniedException;
import com.plaetzchen.security.OwnershipEnforcer;
import com.plaetzchen.security.PlatformSecurityContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Discussion threads and posts.
 *
 * <p>A new post notifies the thread creator (reply), every member it mentions as {@code
 * @DisplayName} and the author of the post it quotes.
 */
@Service
public class ForumService {

    private static final Logger log = LoggerFactory.getLogger(ForumService.class);

    static final String GUIDELINES_VIOLATION = "Content violates community guidelines";

    private static final Sort THREAD_ORDER =
            Sort.by(Sort.Order.desc("pinned"), Sort.Order.desc("createdAt"), Sort.Order.desc("id"));
    private static final Sort OLDEST_FIRST = Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("id"));
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final ForumThreadRepository threads;
    private final ForumPostRepository posts;
    private final ForumCategoryRepository categories;
    private final UserRepository users;
    private final UserLookup userLookup;
    private final ContentModerator moderator;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    public ForumService(
            ForumThreadRepository threads,
            ForumPostRepository posts,
            ForumCategoryRepository categories,
            UserRepository users,
            UserLookup userLookup,
            ContentModerator moderator,
            NotificationPublisher notificationPublisher,
            Clock clock) {
        this.threads = threads;
        this.posts = posts;
        this.categories = categories;
        this.users = users;
        this.userLookup = userLookup;
        this.moderator = moderator;
        this.notificationPublisher = notificationPublisher;
        this.clock = clock;
    }

    // ── Threads ──

    @Transactional(readOnly = true)
    public List<ThreadView> listThreads(Long categoryId, int skip, int limit) {
        OffsetLimit page = OffsetLimit.of(skip, limit, THREAD_ORDER);
        List<ForumThread> result =
                categoryId != null
                        ? threads.findByCategoryId(categoryId, page)
                        : threads.findAll(page).getContent();
        return toThreadViews(result);
    }

    @Transactional(readOnly = true)
    public ThreadView getThread(long threadId) {
        return toThreadViews(List.of(thread(threadId))).get(0);
    }

    @Transactional(readOnly = true)
    public List<ThreadView> threadsBy(long userId, int skip, int limit) {
        return toThreadViews(threads.findByCreatorId(userId, OffsetLimit.of(skip, limit, NEWEST_FIRST)));
    }

    @Transactional
    public ThreadView createThread(PlatformSecurityContext ctx, ThreadCreate request) {
        requireActiveCategory(request.categoryId());
        ForumThread thread =
                threads.save(
                        new ForumThread(
                                request.title().trim(),
                                ctx.userId(),
                                request.categoryId(),
                                Instant.now(clock)));
        log.info("User {} created thread {} '{}'", ctx.userId(), thread.getId(), thread.getTitle());
        return getThread(thread.getId());
    }

    @Transactional
    public ThreadView updateThread(PlatformSecurityContext ctx, long threadId, ThreadUpdate request) {
        ForumThread thread = thread(threadId);
        OwnershipEnforcer.enforce(ctx, thread.getCreatorId(), "Not authorized to edit this thread");
        if ((request.isPinned() != null || request.isLocked() != null) && !ctx.isAdmin()) {
            throw new AccessDeniedException("Only admins can pin/lock threads");
        }
        if (request.title() != null) {
            thread.setTitle(request.title().trim());
        }
        if (request.categoryId() != null) {
            requireActiveCategory(request.categoryId());
            thread.setCategoryId(request.categoryId());
        }
        if (request.isPinned() != null) {
            thread.setPinned(request.isPinned());
        }
        if (request.isLocked() != null) {
            thread.setLocked(request.isLocked());
        }
        return getThread(threadId);
    }

    /** Deletes a thread together with its posts and polls. */
    @Transactional
    public void deleteThread(PlatformSecurityContext ctx, long threadId) {
        ForumThread thread = thread(threadId);
        OwnershipEnforcer.enforce(ctx, thread.getCreatorId(), "Not authorized to delete this thread");
        threads.delete(thread);
        log.info("User {} deleted thread {}", ctx.userId(), threadId);
    }

    // ── Posts ──

    @Transactional(readOnly = true)
    public List<PostView> listPosts(long threadId, int skip, int limit) {
        thread(threadId);
        return toPostViews(posts.findByThreadId(threadId, OffsetLimit.of(skip, limit, OLDEST_FIRST)));
    }

    @Transactional(readOnly = true)
    public List<PostView> postsBy(long userId, int skip, int limit) {
        return toPostViews(posts.findByAuthorId(userId, OffsetLimit.of(skip, limit, NEWEST_FIRST)));
    }

    /**
     * Adds a post to a thread and publishes reply, mention and quote notifications.
     *
     * @throws BusinessRuleException if the thread is locked, the content is flagged or the quoted
     *     post belongs to another thread
     */
    @Transactional
    public PostView createPost(PlatformSecurityContext ctx, long threadId, PostCreate request) {
        ForumThread thread = thread(threadId);
        if (thread.isLocked() && !ctx.isAdmin()) {
            throw new BusinessRuleException("Thread is locked");
        }
        String content = request.content().trim();
        if (moderator.analyze(content).isFlagged()) {
            throw new BusinessRuleException(GUIDELINES_VIOLATION);
        }
        ForumPost quoted = null;
        if (request.quotedPostId() != null) {
            quoted =
                    posts.findById(request.quotedPostId())
                            .filter(p -> p.getThreadId().equals(threadId))
                            .orElseThrow(
                                    () ->
                                            new BusinessRuleException(
                                                    "Quoted post must belong to the same thread"));
        }

        ForumPost post =
                posts.save(
                        new ForumPost(
                                content,
                                ctx.userId(),
                                threadId,
                                quoted != null ? quoted.getId() : null,
                                Instant.now(clock)));
        log.info("User {} posted {} in thread {}", ctx.userId(), post.getId(), threadId);

        notifyAboutPost(ctx, thread, post, quoted);
        return PostView.of(post, userLookup.summary(ctx.userId()));
    }

    @Transactional
    public PostView updatePost(PlatformSecurityContext ctx, long postId, PostUpdate request) {
        ForumPost post = post(postId);
        OwnershipEnforcer.enforce(ctx, post.getAuthorId(), "Not authorized to edit this post");
        String content = request.content().trim();
        if (moderator.analyze(content).isFlagged()) {
            throw new BusinessRuleException(GUIDELINES_VIOLATION);
        }
        post.edit(content, Instant.now(clock));
        return PostView.of(post, userLookup.summary(post.getAuthorId()));
    }

    @Transactional
    public void deletePost(PlatformSecurityContext ctx, long postId) {
        ForumPost post = post(postId);
        OwnershipEnforcer.enforce(ctx, post.getAuthorId(), "Not authorized to delete this post");
        posts.delete(post);
        log.info("User {} deleted post {}", ctx.userId(), postId);
    }

    // ── Helpers ──

    private void notifyAboutPost(
            PlatformSecurityContext ctx, ForumThread thread, ForumPost post, ForumPost quoted) {
        ActorSummary actor = new ActorSummary(ctx.userId(), ctx.user().displayName());
        String preview = ContentPreview.of(post.getContent());
        EventEntity entity = EventEntity.of(EntityType.FORUM_POST, post.getId());
        ForumPostPayload payload =
                new ForumPostPayload(thread.getId(), post.getId(), thread.getTitle(), preview, actor, null);

        notificationPublisher.publish(
                EventType.FORUM_REPLY, ctx.userId(), thread.getCreatorId(), entity, payload);

        Set<String> mentioned = MentionParser.parse(post.getContent());
        if (!mentioned.isEmpty()) {
            for (User user : users.findByDisplayNameInAndActiveTrue(mentioned)) {
                if (user.getId().equals(ctx.userId()) || user.getId().equals(thread.getCreatorId())) {
                    continue;
                }
                notificationPublisher.publish(
                        EventType.FORUM_MENTION, ctx.userId(), user.getId(), entity, payload);
            }
        }

        if (quoted != null) {
            notificationPublisher.publish(
                    EventType.FORUM_QUOTE,
                    ctx.userId(),
                    quoted.getAuthorId(),
                    entity,
                    new ForumPostPayload(
                            thread.getId(), post.getId(), thread.getTitle(), preview, actor, quoted.getId()));
        }
    }

    private void requireActiveCategory(Long categoryId) {
        categories
                .findById(categoryId)
                .filter(ForumCategory::isActive)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found"));
    }

    private ForumThread thread(long threadId) {
        return threads.findById(threadId)
                .orElseThrow(() -> new ResourceNotFoundException("Thread not found"));
    }

    private ForumPost post(long postId) {
        return posts.findById(postId).orElseThrow(() -> new ResourceNotFoundException("Post not found"));
    }

    private List<ThreadView> toThreadViews(List<ForumThread> page) {
        if (page.isEmpty()) {
            return List.of();
        }
        Map<Long, Long> postCounts = new HashMap<>();
        for (Object[] row : posts.countByThreadIds(page.stream().map(ForumThread::getId).toList())) {
            postCounts.put((Long) row[0], ((Number) row[1]).longValue());
        }
        Map<Long, ForumPost> latest = new HashMap<>();
        for (ForumThread t : page) {
            posts.findFirstByThreadIdOrderByCreatedAtDescIdDesc(t.getId()).ifPresent(p -> latest.put(t.getId(), p));
        }
        List<Long> people =
                new ArrayList<>(page.stream().map(ForumThread::getCreatorId).toList());
        latest.values().forEach(p -> people.add(p.getAuthorId()));
        Map<Long, UserSummary> summaries = userLookup.summaries(people);

        return page.stream()
                .map(
                        t -> {
                            ForumPost last = latest.get(t.getId());
                            return ThreadView.of(
                                    t,
                                    UserLookup.from(summaries, t.getCreatorId()),
                                    postCounts.getOrDefault(t.getId(), 0L),
                                    last != null
                                            ? PostView.of(last, UserLookup.from(summaries, last.getAuthorId()))
                                            : null);
                        })
                .toList();
    }

    private List<PostView> toPostViews(List<ForumPost> page) {
        Map<Long, UserSummary> authors =
                userLookup.summaries(page.stream().map(ForumPost::getAuthorId).toList());
        return page.stream()
                .map(p -> PostView.of(p, UserLookup.from(authors, p.getAuthorId())))
                .toList();
    }
}
