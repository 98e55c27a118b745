package com.plaetzchen.community.domain.event;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** One member's participation in one event. Re-joining reuses the row. */
@Entity
@Table(name = "event_participations")
public class EventParticipation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false)
    private Long eventId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ParticipationStatus status;

    @Column(name = "registered_at", nullable = false)
    private Instant registeredAt;

    @Column(name = "status_updated_at")
    private Instant statusUpdatedAt;

    protected EventParticipation() {
        // JPA
    }

    public EventParticipation(Long eventId, Long userId, Instant registeredAt) {
        this.eventId = eventId;
        this.userId = userId;
        this.status = ParticipationStatus.REGISTERED;
        this.registeredAt = registeredAt;
    }

    public void changeStatus(ParticipationStatus newStatus, Instant at) {
        this.status = newStatus;
        this.statusUpdatedAt = at;
    }

    public Long getId() {
        return id;
    }

    public Long getEventId() {
        return eventId;
    }

    public Long getUserId() {
        return userId;
    }

    public ParticipationStatus getStatus() {
        return status;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public Instant getStatusUpdatedAt() {
        return statusUpdatedAt;
    }
}
