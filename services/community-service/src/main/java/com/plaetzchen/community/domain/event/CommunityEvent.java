package com.plaetzchen.community.domain.event;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * A neighbourhood event members can join.
 *
 * <p>Members and categories are referenced by id; views resolve them when needed. Deleting an
 * event only deactivates it so comments and participation history survive.
 */
@Entity
@Table(name = "events")
public class CommunityEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String title;

    private String description;

    @Column(name = "start_datetime", nullable = false)
    private Instant startDatetime;

    @Column(name = "end_datetime")
    private Instant endDatetime;

    private String location;

    @Column(name = "max_participants")
    private Integer maxParticipants;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "creator_id", nullable = false)
    private Long creatorId;

    @Column(name = "category_id", nullable = false)
    private Long categoryId;

    protected CommunityEvent() {
        // JPA
    }

    public CommunityEvent(
            String title,
            String description,
            Instant startDatetime,
            Instant endDatetime,
            String location,
            Integer maxParticipants,
            Long creatorId,
            Long categoryId,
            Instant createdAt) {
        this.title = title;
        this.description = description;
        this.startDatetime = startDatetime;
        this.endDatetime = endDatetime;
        this.location = location;
        this.maxParticipants = maxParticipants;
        this.creatorId = creatorId;
        this.categoryId = categoryId;
        this.createdAt = createdAt;
    }

    /** End of the event, or its start for events without an end time. */
    public Instant effectiveEnd() {
        return endDatetime != null ? endDatetime : startDatetime;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Instant getStartDatetime() {
        return startDatetime;
    }

    public void setStartDatetime(Instant startDatetime) {
        this.startDatetime = startDatetime;
    }

    public Instant getEndDatetime() {
        return endDatetime;
    }

    public void setEndDatetime(Instant endDatetime) {
        this.endDatetime = endDatetime;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public Integer getMaxParticipants() {
        return maxParticipants;
    }

    public void setMaxParticipants(Integer maxParticipants) {
        this.maxParticipants = maxParticipants;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Long getCreatorId() {
        return creatorId;
    }

    public Long getCategoryId() {
        return categoryId;
    }

    public void setCategoryId(Long categoryId) {
        this.categoryId = categoryId;
    }
}
