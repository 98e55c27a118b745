package com.plaetzchen.community.domain.comment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** A comment on exactly one event or one service listing, optionally replying to another. */
@Entity
@Table(name = "comments")
public class Comment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 1000)
    private String content;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "author_id", nullable = false)
    private Long authorId;

    @Column(name = "parent_id")
    private Long parentId;

    @Column(name = "event_id")
    private Long eventId;

    @Column(name = "service_id")
    private Long serviceId;

    protected Comment() {
        // JPA
    }

    public Comment(
            String content, Long authorId, Long parentId, Long eventId, Long serviceId, Instant createdAt) {
        this.content = content;
        this.authorId = authorId;
        this.parentId = parentId;
        this.eventId = eventId;
        this.serviceId = serviceId;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Long getAuthorId() {
        return authorId;
    }

    public Long getParentId() {
        return parentId;
    }

    public Long getEventId() {
        return eventId;
    }

    public Long getServiceId() {
        return serviceId;
    }
}
