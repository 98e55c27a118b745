package com.plaetzchen.community.domain.event;

/** Outcome of marking an ended event's registered participants as attended. */
public record AutoAttendanceResult(boolean success, String reason, int participantsUpdated) {

    static AutoAttendanceResult tooEarly(long delayHours) {
        return new AutoAttendanceResult(false, "Event ended less than " + delayHours + "h ago", 0);
    }

    static AutoAttendanceResult nothingToDo() {
        return new AutoAttendanceResult(false, "No participants to update", 0);
    }

    static AutoAttendanceResult processed(int updated) {
        return new AutoAttendanceResult(true, "Auto-attendance processed successfully", updated);
    }
}
