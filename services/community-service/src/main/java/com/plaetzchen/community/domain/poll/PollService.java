package com.plaetzchen.community.domain.poll;

import com.plaetzchen.community.domain.common.BusinessRuleException;
import com.plaetzchen.community.domain.common.OffsetLimit;
import com.plaetzchen.community.domain.common.ResourceNotFoundException;
import com.plaetzchen.community.domain.forum.ForumThread;
import com.plaetzchen.community.domain.forum.ForumThreadRepository;
import com.plaetzchen.community.domain.user.UserLookup;
import com.plaetzchen.community.domain.user.UserSummary;
import com.plaetzchen.observability.MetricFactory;
import com.plaetzchen.security.AccessDeniedException;
import com.plaetzchen.security.OwnershipEnforcer;
import com.plaetzchen.security.PlatformSecurityContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Polls, votes and results.
 *
 * <p>Each member holds at most one vote per poll; voting again moves the vote. Once the first vote
 * is cast the options are frozen.
 */
@Service
public class PollService {

    private static final Logger log = LoggerFactory.getLogger(PollService.class);

    static final String METRIC_VOTES = "community.polls.votes";

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final PollRepository polls;
    private final PollOptionRepository options;
    private final PollVoteRepository votes;
    private final ForumThreadRepository threads;
    private final UserLookup userLookup;
    private final MetricFactory metrics;
    private final Clock clock;

    public PollService(
            PollRepository polls,
            PollOptionRepository options,
            PollVoteRepository votes,
            ForumThreadRepository threads,
            UserLookup userLookup,
            MetricFactory metrics,
            Clock clock) {
        this.polls = polls;
        this.options = options;
        this.votes = votes;
        this.threads = threads;
        this.userLookup = userLookup;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ── Queries ──

    @Transactional(readOnly = true)
    public List<PollView> list(
            Long viewerId, PollType pollType, Long threadId, boolean activeOnly, int skip, int limit) {
        Specification<Poll> spec = Specification.where(null);
        if (pollType != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("pollType"), pollType));
        }
        if (threadId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("threadId"), threadId));
        }
        if (activeOnly) {
            spec = spec.and((root, query, cb) -> cb.isTrue(root.get("active")));
        }
        return toViews(polls.findAll(spec, OffsetLimit.of(skip, limit, NEWEST_FIRST)).getContent(), viewerId);
    }

    @Transactional(readOnly = true)
    public PollView get(Long viewerId, long pollId) {
        return toViews(List.of(poll(pollId)), viewerId).get(0);
    }

    @Transactional(readOnly = true)
    public List<PollView> createdBy(long userId, int skip, int limit) {
        return toViews(polls.findByCreatorId(userId, OffsetLimit.of(skip, limit, NEWEST_FIRST)), userId);
    }

    /** Polls the member voted in, most recent vote first. */
    @Transactional(readOnly = true)
    public List<PollView> votedBy(long userId, int skip, int limit) {
        List<Long> pollIds =
                votes.findByUserId(userId, OffsetLimit.of(skip, limit, NEWEST_FIRST)).stream()
                        .map(PollVote::getPollId)
                        .toList();
        Map<Long, Poll> byId =
                polls.findAllById(pollIds).stream().collect(Collectors.toMap(Poll::getId, p -> p));
        List<Poll> ordered = pollIds.stream().map(byId::get).filter(p -> p != null).toList();
        return toViews(ordered, userId);
    }

    @Transactional(readOnly = true)
    public PollStatsView stats(long userId) {
        long created = polls.countByCreatorId(userId);
        long cast = votes.countByUserId(userId);
        return new PollStatsView(created, cast, PollRules.engagementLevel(created, cast));
    }

    @Transactional(readOnly = true)
    public PollResults results(long pollId) {
        Poll poll = poll(pollId);
        List<PollOption> pollOptions = options.findByPollIdOrderByOrderIndexAsc(pollId);
        return PollResults.tally(poll, pollOptions, voteCounts(List.of(pollId)), Instant.now(clock));
    }

    // ── Commands ──

    @Transactional
    public PollView create(PlatformSecurityContext ctx, PollCreate request) {
        if (request.pollType() == PollType.ADMIN && !ctx.isAdmin()) {
            throw new AccessDeniedException("Only admins can create admin polls");
        }
        if (request.pollType() == PollType.THREAD && request.threadId() == null) {
            throw new BusinessRuleException("Thread polls require a threadId");
        }
        if (request.pollType() == PollType.ADMIN && request.threadId() != null) {
            throw new BusinessRuleException("Admin polls cannot belong to a thread");
        }
        if (request.threadId() != null) {
            ForumThread thread =
                    threads.findById(request.threadId())
                            .orElseThrow(() -> new ResourceNotFoundException("Thread not found"));
            if (thread.isLocked() && !ctx.isAdmin()) {
                throw new BusinessRuleException("Cannot create poll in locked thread");
            }
        }
        PollRules.checkOptionCount(request.options());
        Instant now = Instant.now(clock);
        Instant endsAt =
                request.endsAt() != null
                        ? request.endsAt()
                        : now.plus(PollRules.suggestedDuration(request.pollType(), request.expectedParticipants()));
        checkEndsAt(endsAt, now);

        Poll poll =
                polls.save(
                        new Poll(
                                request.question().trim(),
                                request.pollType(),
                                endsAt,
                                ctx.userId(),
                                request.threadId(),
                                now));
        saveOptions(poll.getId(), request.options());
        log.info("User {} created {} poll {}", ctx.userId(), request.pollType(), poll.getId());
        return get(ctx.userId(), poll.getId());
    }

    @Transactional
    public PollView update(PlatformSecurityContext ctx, long pollId, PollUpdate request) {
        Poll poll = poll(pollId);
        OwnershipEnforcer.enforce(ctx, poll.getCreatorId(), "Not authorized to edit this poll");
        if (request.options() != null) {
            if (votes.countByPollId(pollId) > 0) {
                throw new BusinessRuleException(
                        "Can only change question, end date, or status once voting has started");
            }
            PollRules.checkOptionCount(request.options());
            options.deleteByPollId(pollId);
            options.flush();
            saveOptions(pollId, request.options());
        }
        if (request.question() != null) {
            poll.setQuestion(request.question().trim());
        }
        if (request.endsAt() != null) {
            checkEndsAt(request.endsAt(), Instant.now(clock));
            poll.setEndsAt(request.endsAt());
        }
        if (request.isActive() != null) {
            poll.setActive(request.isActive());
        }
        return get(ctx.userId(), pollId);
    }

    @Transactional
    public void delete(PlatformSecurityContext ctx, long pollId) {
        Poll poll = poll(pollId);
        OwnershipEnforcer.enforce(ctx, poll.getCreatorId(), "Not authorized to delete this poll");
        polls.delete(poll);
        log.info("User {} deleted poll {}", ctx.userId(), pollId);
    }

    /**
     * Casts or moves the caller's vote.
     *
     * @throws ResourceNotFoundException if the poll is missing or inactive
     * @throws BusinessRuleException if the poll has ended or the option belongs to another poll
     */
    @Transactional
    public PollView vote(PlatformSecurityContext ctx, long pollId, long optionId) {
        Poll poll = activePoll(pollId);
        Instant now = Instant.now(clock);
        if (poll.hasEnded(now)) {
            throw new BusinessRuleException("Poll has ended");
        }
        options.findById(optionId)
                .filter(o -> o.getPollId().equals(pollId))
                .orElseThrow(() -> new BusinessRuleException("Invalid option for this poll"));

        votes.findByPollIdAndUserId(pollId, ctx.userId())
                .ifPresentOrElse(
                        existing -> existing.switchTo(optionId, now),
                        () -> votes.save(new PollVote(ctx.userId(), pollId, optionId, now)));
        metrics.increment(METRIC_VOTES, "Poll votes cast");
        log.info("User {} voted on poll {}", ctx.userId(), pollId);
        return get(ctx.userId(), pollId);
    }

    @Transactional
    public void removeVote(PlatformSecurityContext ctx, long pollId) {
        activePoll(pollId);
        PollVote vote =
                votes.findByPollIdAndUserId(pollId, ctx.userId())
                        .orElseThrow(() -> new BusinessRuleException("No vote to remove"));
        votes.delete(vote);
        log.info("User {} removed vote on poll {}", ctx.userId(), pollId);
    }

    // ── Helpers ──

    private void saveOptions(Long pollId, List<String> texts) {
        List<PollOption> rows = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            rows.add(new PollOption(pollId, texts.get(i).trim(), i));
        }
        options.saveAll(rows);
    }

    private void checkEndsAt(Instant endsAt, Instant now) {
        if (!endsAt.isAfter(now)) {
            throw new BusinessRuleException("Poll end date must be in the future");
        }
    }

    private Poll poll(long pollId) {
        return polls.findById(pollId).orElseThrow(() -> new ResourceNotFoundException("Poll not found"));
    }

    private Poll activePoll(long pollId) {
        return polls.findById(pollId)
                .filter(Poll::isActive)
                .orElseThrow(() -> new ResourceNotFoundException("Poll not found or inactive"));
    }

    private Map<Long, Long> voteCounts(List<Long> pollIds) {
        Map<Long, Long> counts = new HashMap<>();
        for (Object[] row : votes.countByOption(pollIds)) {
            counts.put((Long) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    private List<PollView> toViews(List<Poll> page, Long viewerId) {
        if (page.isEmpty()) {
            return List.of();
        }
        List<Long> pollIds = page.stream().map(Poll::getId).toList();
        Map<Long, List<PollOption>> optionsByPoll = new LinkedHashMap<>();
        for (PollOption option : options.findByPollIdInOrderByOrderIndexAsc(pollIds)) {
            optionsByPoll.computeIfAbsent(option.getPollId(), id -> new ArrayList<>()).add(option);
        }
        Map<Long, Long> counts = voteCounts(pollIds);
        Map<Long, Long> viewerVotes = new HashMap<>();
        if (viewerId != null) {
            for (PollVote vote : votes.findByUserIdAndPollIdIn(viewerId, pollIds)) {
                viewerVotes.put(vote.getPollId(), vote.getOptionId());
            }
        }
        Map<Long, UserSummary> creators =
                userLookup.summaries(page.stream().map(Poll::getCreatorId).toList());

        return page.stream()
                .map(
                        poll -> {
                            List<PollOptionView> optionViews =
                                    optionsByPoll.getOrDefault(poll.getId(), List.of()).stream()
                                            .map(
                                                    o ->
                                                            new PollOptionView(
                                                                    o.getId(),
                                                                    o.getText(),
                                                                    o.getOrderIndex(),
                                                                    counts.getOrDefault(o.getId(), 0L)))
                                            .toList();
                            long total = optionViews.stream().mapToLong(PollOptionView::voteCount).sum();
                            return new PollView(
                                    poll.getId(),
                                    poll.getQuestion(),
                                    poll.getPollType(),
                                    poll.isActive(),
                                    poll.getEndsAt(),
                                    poll.getCreatedAt(),
                                    UserLookup.from(creators, poll.getCreatorId()),
                                    poll.getThreadId(),
                                    optionViews,
                                    total,
                                    viewerVotes.get(poll.getId()));
                        })
                .toList();
    }
}
