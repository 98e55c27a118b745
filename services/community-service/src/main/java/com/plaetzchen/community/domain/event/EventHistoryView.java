package com.plaetzchen.community.domain.event;

/**
 * A member's event history.
 *
 * @param attendanceRate attended / (attended + cancelled) in percent, one decimal; 0 with no data
 * @param engagementLevel {@code new}, {@code low}, {@code moderate}, {@code high} or {@code
 *     very_high} by total participations
 */
public record EventHistoryView(
        long upcomingEvents,
        long eventsAttended,
        long eventsCancelled,
        double attendanceRate,
        long totalEvents,
        String engagementLevel) {

    public static EventHistoryView of(long registered, long attended, long cancelled) {
        long decided = attended + cancelled;
        double rate = decided == 0 ? 0.0 : Math.round(attended * 1000.0 / decided) / 10.0;
        long total = registered + attended + cancelled;
        return new EventHistoryView(registered, attended, cancelled, rate, total, engagementLevel(total));
    }

    static String engagementLevel(long totalEvents) {
        if (totalEvents == 0) {
            return "new";
        }
        if (totalEvents < 3) {
            return "low";
        }
        if (totalEvents < 10) {
            return "moderate";
        }
        if (totalEvents < 25) {
            return "high";
        }
        return "very_high";
    }
}
