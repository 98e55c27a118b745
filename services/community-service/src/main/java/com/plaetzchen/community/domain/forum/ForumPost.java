package com.plaetzchen.community.domain.forum;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "forum_posts")
public class ForumPost {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 5000)
    private String content;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "author_id", nullable = false)
    private Long authorId;

    @Column(name = "thread_id", nullable = false)
    private Long threadId;

    @Column(name = "quoted_post_id")
    private Long quotedPostId;

    protected ForumPost() {
        // JPA
    }

    public ForumPost(String content, Long authorId, Long threadId, Long quotedPostId, Instant createdAt) {
        this.content = content;
        this.authorId = authorId;
        this.threadId = threadId;
        this.quotedPostId = quotedPostId;
        this.createdAt = createdAt;
    }

    public void edit(String newContent, Instant at) {
        this.content = newContent;
        this.updatedAt = at;
    }

    public Long getId() {
        return id;
    }

    public String getContent() {
        return content;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Long getAuthorId() {
        return authorId;
    }

    public Long getThreadId() {
        return threadId;
    }

    public Long getQuotedPostId() {
        return quotedPostId;
    }
}
