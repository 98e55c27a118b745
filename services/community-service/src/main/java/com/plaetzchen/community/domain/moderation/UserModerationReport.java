package com.plaetzchen.community.domain.moderation;

import java.util.List;

/**
 * Re-analysis of a member's recent content.
 *
 * @param needsAdminReview more than three flagged items, or average confidence above 0.5
 */
public record UserModerationReport(
        long userId,
        int totalItemsChecked,
        int flaggedItems,
        double averageConfidence,
        boolean needsAdminReview,
        List<FlaggedItem> flagged) {

    public record FlaggedItem(String type, long id, double confidence, List<String> reasons) {}
}
