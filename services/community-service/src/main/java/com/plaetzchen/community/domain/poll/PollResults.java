package com.plaetzchen.community.domain.poll;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Tally of a poll.
 *
 * <p>{@code winners} holds every option with the highest count, so a tie lists several; with no
 * votes at all there are no winners.
 */
public record PollResults(
        long pollId,
        String question,
        long totalVotes,
        List<OptionResult> options,
        List<OptionResult> winners,
        String resultType,
        boolean isConcluded,
        String participationRate) {

    public record OptionResult(long optionId, String text, long votes, double percentage) {}

    /** Reduced form returned when {@code detailed=false}. */
    public record Summary(long pollId, long totalVotes, List<OptionResult> winners, String resultType) {}

    public Summary summary() {
        return new Summary(pollId, totalVotes, winners, resultType);
    }

    /**
     * @param voteCounts votes per option id; options without votes may be absent
     */
    public static PollResults tally(
            Poll poll, List<PollOption> options, Map<Long, Long> voteCounts, Instant now) {
        long total = voteCounts.values().stream().mapToLong(Long::longValue).sum();
        List<OptionResult> results =
                options.stream()
                        .map(
                                o -> {
                                    long votes = voteCounts.getOrDefault(o.getId(), 0L);
                                    return new OptionResult(
                                            o.getId(), o.getText(), votes, percentage(votes, total));
                                })
                        .toList();
        long max = results.stream().mapToLong(OptionResult::votes).max().orElse(0);
        List<OptionResult> winners =
                max > 0 ? results.stream().filter(r -> r.votes() == max).toList() : List.of();
        String resultType;
        if (winners.isEmpty()) {
            resultType = "no_votes";
        } else if (winners.size() == 1) {
            resultType = "clear_winner";
        } else {
            resultType = "tie";
        }
        return new PollResults(
                poll.getId(),
                poll.getQuestion(),
                total,
                results,
                winners,
                resultType,
                poll.hasEnded(now),
                participationRate(total));
    }

    static double percentage(long votes, long total) {
        return Math.round(votes * 1000.0 / Math.max(1, total)) / 10.0;
    }

    static String participationRate(long totalVotes) {
        if (totalVotes == 0) {
            return "no_participation";
        }
        if (totalVotes < 5) {
            return "low";
        }
        if (totalVotes < 20) {
            return "moderate";
        }
        return "high";
    }
}
