package com.plaetzchen.community.domain.poll;

import com.plaetzchen.community.domain.user.UserSummary;
import java.time.Instant;
import java.util.List;

/**
 * Poll with live vote counts.
 *
 * @param userVoteOptionId option the caller voted for, {@code null} if none or anonymous
 */
public record PollView(
        long id,
        String question,
        PollType pollType,
        boolean isActive,
        Instant endsAt,
        Instant createdAt,
        UserSummary creator,
        Long threadId,
        List<PollOptionView> options,
        long totalVotes,
        Long userVoteOptionId) {}
