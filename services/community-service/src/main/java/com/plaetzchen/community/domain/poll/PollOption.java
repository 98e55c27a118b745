package com.plaetzchen.community.domain.poll;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "poll_options")
public class PollOption {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "poll_id", nullable = false)
    private Long pollId;

    @Column(name = "option_text", nullable = false, length = 200)
    private String text;

    @Column(name = "order_index", nullable = false)
    private int orderIndex;

    protected PollOption() {
        // JPA
    }

    public PollOption(Long pollId, String text, int orderIndex) {
        this.pollId = pollId;
        this.text = text;
        this.orderIndex = orderIndex;
    }

    public Long getId() {
        return id;
    }

    public Long getPollId() {
        return pollId;
    }

    public String getText() {
        return text;
    }

    public int getOrderIndex() {
        return orderIndex;
    }
}
