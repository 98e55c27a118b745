package com.plaetzchen.community.domain.moderation;

import java.util.List;

/**
 * Outcome of analyzing one piece of member content.
 *
 * @param confidence accumulated rule score, capped at 1.0
 * @param reasons one entry per rule that matched
 */
public record ModerationResult(
        boolean isFlagged, double confidence, List<String> reasons, boolean requiresReview) {

    public ModerationResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static ModerationResult clean() {
        return new ModerationResult(false, 0.0, List.of(), false);
    }

    /** Reasons joined for storage in a single column. */
    public String summary() {
        return String.join("; ", reasons);
    }
}
