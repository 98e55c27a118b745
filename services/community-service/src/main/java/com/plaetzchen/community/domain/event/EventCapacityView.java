package com.plaetzchen.community.domain.event;

/**
 * Capacity of an event.
 *
 * @param availableSpots {@code null} without a limit
 * @param utilizationPercentage share of the limit in use, one decimal; 0 without a limit
 */
public record EventCapacityView(
        boolean hasCapacityLimit,
        Integer maxParticipants,
        long currentParticipants,
        Long availableSpots,
        boolean isFull,
        double utilizationPercentage) {

    public static EventCapacityView of(Integer maxParticipants, long registered) {
        if (maxParticipants == null) {
            return new EventCapacityView(false, null, registered, null, false, 0.0);
        }
        double utilization = Math.round(registered * 1000.0 / maxParticipants) / 10.0;
        return new EventCapacityView(
                true,
                maxParticipants,
                registered,
                Math.max(0, maxParticipants - registered),
                isFull(maxParticipants, registered),
                utilization);
    }

    static boolean isFull(Integer maxParticipants, long registered) {
        return maxParticipants != null && registered >= maxParticipants;
    }
}
