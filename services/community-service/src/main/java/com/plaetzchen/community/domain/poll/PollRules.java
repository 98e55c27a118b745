package com.plaetzchen.community.domain.poll;

import com.plaetzchen.community.domain.common.BusinessRuleException;
import java.time.Duration;
import java.util.List;

/** Constants and checks shared by poll creation and editing. */
public final class PollRules {

    public static final int MIN_OPTIONS = 2;
    public static final int MAX_OPTIONS = 10;

    static final Duration ADMIN_POLL_DURATION = Duration.ofHours(168);
    static final Duration LARGE_THREAD_POLL_DURATION = Duration.ofHours(72);
    static final Duration THREAD_POLL_DURATION = Duration.ofHours(48);
    static final int LARGE_AUDIENCE = 50;

    private PollRules() {
        // utility class
    }

    /**
     * Default running time of a poll: a week for admin polls, three days for thread polls
     * expecting more than 50 voters, two days otherwise.
     */
    public static Duration suggestedDuration(PollType type, Integer expectedParticipants) {
        if (type == PollType.ADMIN) {
            return ADMIN_POLL_DURATION;
        }
        if (expectedParticipants != null && expectedParticipants > LARGE_AUDIENCE) {
            return LARGE_THREAD_POLL_DURATION;
        }
        return THREAD_POLL_DURATION;
    }

    static void checkOptionCount(List<String> options) {
        int count = options == null ? 0 : options.size();
        if (count < MIN_OPTIONS || count > MAX_OPTIONS) {
            throw new BusinessRuleException(
                    "Poll must have between " + MIN_OPTIONS + " and " + MAX_OPTIONS + " options");
        }
    }

    /** Activity weighs created polls double: {@code inactive}, {@code low}, {@code moderate}, {@code high}. */
    static String engagementLevel(long pollsCreated, long votesCast) {
        long activity = pollsCreated * 2 + votesCast;
        if (activity == 0) {
            return "inactive";
        }
        if (activity < 5) {
            return "low";
        }
        if (activity < 15) {
            return "moderate";
        }
        return "high";
    }
}
