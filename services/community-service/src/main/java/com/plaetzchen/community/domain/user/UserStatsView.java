package com.plaetzchen.community.domain.user;

/**
 * Community activity of one member.
 *
 * @param totalConnections events attended plus events organized
 * @param communityScore weighted activity, capped at {@value #MAX_SCORE}
 */
public record UserStatsView(
        long eventsAttended,
        long eventsOrganized,
        long servicesOffered,
        long totalConnections,
        int communityScore) {

    public static final int MAX_SCORE = 100;

    public static UserStatsView of(long attended, long organized, long servicesOffered) {
        long score = attended * 5 + organized * 10 + servicesOffered * 8;
        return new UserStatsView(
                attended,
                organized,
                servicesOffered,
                attended + organized,
                (int) Math.min(MAX_SCORE, score));
    }
}
