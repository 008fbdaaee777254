package com.mingle.backend.modules.comment.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.mingle.backend.modules.auth.domain.MingleUser;
import com.mingle.backend.modules.post.domain.Post;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Append-only comment. Threads are read in {@code createdAt} order; the database-assigned
 * {@code seq} keeps insertion order among comments made at the same instant.
 */
@Entity
@Table(name = "post_comment")
public class PostComment {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "post_id", nullable = false, updatable = false)
    private Post post;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author_user_id", nullable = false, updatable = false)
    private MingleUser author;

    @Column(name = "text", nullable = false, updatable = false, length = 500)
    private String text;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "seq", insertable = false, updatable = false)
    private Long seq;

    protected PostComment() {
    }

    public PostComment(Post post, MingleUser author, String text, OffsetDateTime createdAt) {
        this.post = post;
        this.author = author;
        this.text = text;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public Post getPost() {
        return post;
    }

    public MingleUser getAuthor() {
        return author;
    }

    public String getText() {
        return text;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
