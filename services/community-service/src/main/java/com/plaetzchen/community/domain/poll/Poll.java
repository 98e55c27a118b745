package com.plaetzchen.community.domain.poll;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "polls")
public class Poll {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 500)
    private String question;

    @Enumerated(EnumType.STRING)
    @Column(name = "poll_type", nullable = false, length = 10)
    private PollType pollType;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "ends_at")
    private Instant endsAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "creator_id", nullable = false)
    private Long creatorId;

    @Column(name = "thread_id")
    private Long threadId;

    protected Poll() {
        // JPA
    }

    public Poll(
            String question,
            PollType pollType,
            Instant endsAt,
            Long creatorId,
            Long threadId,
            Instant createdAt) {
        this.question = question;
        this.pollType = pollType;
        this.endsAt = endsAt;
        this.creatorId = creatorId;
        this.threadId = threadId;
        this.createdAt = createdAt;
    }

    public boolean hasEnded(Instant now) {
        return endsAt != null && endsAt.isBefore(now);
    }

    public Long getId() {
        return id;
    }

    public String getQuestion() {
        return question;
    }

    public void setQuestion(String question) {
        this.question = question;
    }

    public PollType getPollType() {
        return pollType;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getEndsAt() {
        return endsAt;
    }

    public void setEndsAt(Instant endsAt) {
        this.endsAt = endsAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Long getCreatorId() {
        return creatorId;
    }

    public Long getThreadId() {
        return threadId;
    }
}
