package com.plaetzchen.community.domain.poll;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** A member's vote. At most one per member and poll (unique constraint). */
@Entity
@Table(name = "poll_votes")
public class PollVote {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "poll_id", nullable = false)
    private Long pollId;

    @Column(name = "option_id", nullable = false)
    private Long optionId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected PollVote() {
        // JPA
    }

    public PollVote(Long userId, Long pollId, Long optionId, Instant createdAt) {
        this.userId = userId;
        this.pollId = pollId;
        this.optionId = optionId;
        this.createdAt = createdAt;
    }

    public void switchTo(Long newOptionId, Instant at) {
        this.optionId = newOptionId;
        this.createdAt = at;
    }

    public Long getId() {
        return id;
    }

    public Long getUserId() {
        return userId;
    }

    public Long getPollId() {
        return pollId;
    }

    public Long getOptionId() {
        return optionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
