package com.mingle.backend.modules.engagement.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.mingle.backend.global.jpa.AbstractTimestampedEntity;
import com.mingle.backend.modules.auth.domain.MingleUser;
import com.mingle.backend.modules.post.domain.Post;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * The single reaction a user holds on a post. Switching between like and dislike
 * rewrites {@link #type} in place, so both can never exist for the same pair.
 */
@Entity
@Table(
        name = "post_reaction",
        uniqueConstraints = @UniqueConstraint(name = "uq_post_reaction_post_user", columnNames = {"post_id", "user_id"})
)
public class PostReaction extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "post_id", nullable = false, updatable = false)
    private Post post;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private MingleUser user;

    @Enumerated(EnumType.STRING)
    @Column(name = "reaction_type", nullable = false, length = 16)
    private ReactionType type;

    @Column(name = "reacted_at", nullable = false)
    private OffsetDateTime reactedAt;

    protected PostReaction() {
    }

    public PostReaction(Post post, MingleUser user, ReactionType type, OffsetDateTime reactedAt) {
        this.post = post;
        this.user = user;
        this.type = type;
        this.reactedAt = reactedAt;
    }

    public UUID getId() {
        return id;
    }

    public Post getPost() {
        return post;
    }

    public MingleUser getUser() {
        return user;
    }

    public ReactionType getType() {
        return type;
    }

    public OffsetDateTime getReactedAt() {
        return reactedAt;
    }

    /**
     * @return {@code true} when the stored reaction actually changed
     */
    public boolean switchTo(ReactionType newType, OffsetDateTime at) {
        if (this.type == newType) {
            return false;
        }
        this.type = newType;
        this.reactedAt = at;
        return true;
    }
}
