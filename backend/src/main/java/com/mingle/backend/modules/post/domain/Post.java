package com.mingle.backend.modules.post.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.mingle.backend.modules.auth.domain.MingleUser;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

import org.hibernate.annotations.BatchSize;
import org.hibernate.annotations.UuidGenerator;

/**
 * A published post. Everything except the engagement living in other tables is fixed at
 * publication; in particular {@code expiresAt} is computed once from the creation instant.
 */
@Entity
@Table(name = "post")
public class Post {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_user_id", nullable = false, updatable = false)
    private MingleUser owner;

    @Column(name = "title", nullable = false, updatable = false, length = 120)
    private String title;

    @Column(name = "body", nullable = false, updatable = false, length = 2000)
    private String body;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "post_topic", joinColumns = @JoinColumn(name = "post_id"))
    @OrderColumn(name = "topic_position")
    @Column(name = "topic", nullable = false, length = 40)
    @BatchSize(size = 50)
    private List<String> topics = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "expires_in_minutes", nullable = false, updatable = false)
    private int expiresInMinutes;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    protected Post() {
    }

    public static Post publish(
            MingleUser owner,
            String title,
            String body,
            List<String> topics,
            int expiresInMinutes,
            OffsetDateTime createdAt
    ) {
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("a post needs at least one topic");
        }
        if (expiresInMinutes <= 0) {
            throw new IllegalArgumentException("expiresInMinutes must be positive");
        }
        Post post = new Post();
        post.owner = owner;
        post.title = title;
        post.body = body;
        post.topics = new ArrayList<>(topics);
        post.createdAt = createdAt;
        post.expiresInMinutes = expiresInMinutes;
        post.expiresAt = createdAt.plusMinutes(expiresInMinutes);
        return post;
    }

    public UUID getId() {
        return id;
    }

    public MingleUser getOwner() {
        return owner;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public List<String> getTopics() {
        return List.copyOf(topics);
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public int getExpiresInMinutes() {
        return expiresInMinutes;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isOwnedBy(UUID userId) {
        return owner != null && owner.getId() != null && owner.getId().equals(userId);
    }

    public PostLifecycle lifecycleAt(OffsetDateTime now) {
        return PostLifecycle.at(expiresAt, now);
    }
}
