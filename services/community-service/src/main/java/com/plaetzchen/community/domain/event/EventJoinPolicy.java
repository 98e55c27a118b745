package com.plaetzchen.community.domain.event;

import com.plaetzchen.community.domain.common.BusinessRuleException;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a member may register for an event.
 *
 * <p>The checks run in a fixed order and the first failing one wins, so a member joining a past,
 * full event is told the event is in the past.
 */
public final class EventJoinPolicy {

    private final Duration registrationDeadline;

    public EventJoinPolicy(Duration registrationDeadline) {
        this.registrationDeadline = registrationDeadline;
    }

    /**
     * @param existing the member's current participation status, or {@code null} if none
     * @param registeredCount participants currently {@code REGISTERED}
     * @throws BusinessRuleException naming the first rule that fails
     */
    public void check(
            CommunityEvent event,
            ParticipationStatus existing,
            long registeredCount,
            Instant now) {
        if (!event.getStartDatetime().isAfter(now)) {
            throw new BusinessRuleException("Cannot join past events");
        }
        if (!event.isActive()) {
            throw new BusinessRuleException("Event is no longer active");
        }
        if (existing == ParticipationStatus.REGISTERED) {
            throw new BusinessRuleException("Already registered for this event");
        }
        if (EventCapacityView.isFull(event.getMaxParticipants(), registeredCount)) {
            throw new BusinessRuleException("Event is full");
        }
        if (now.isAfter(event.getStartDatetime().minus(registrationDeadline))) {
            throw new BusinessRuleException(
                    "Registration deadline passed (" + registrationDeadline.toHours() + "h before event)");
        }
    }
}
