package com.mingle.backend.modules.engagement.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.mingle.backend.modules.engagement.domain.PostReaction;
import com.mingle.backend.modules.engagement.domain.ReactionType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PostReactionRepository extends JpaRepository<PostReaction, UUID> {

    @Query("select r from PostReaction r where r.post.id = :postId and r.user.id = :userId")
    Optional<PostReaction> findByPostIdAndUserId(@Param("postId") UUID postId, @Param("userId") UUID userId);

    @Query("""
            select r.post.id as postId, r.type as type, count(r) as total
              from PostReaction r
             where r.post.id in :postIds
             group by r.post.id, r.type
            """)
    List<ReactionCountProjection> countByPostIds(@Param("postIds") Collection<UUID> postIds);

    @Query("select count(r) from PostReaction r where r.post.id = :postId and r.type = :type")
    long countByPostIdAndType(@Param("postId") UUID postId, @Param("type") ReactionType type);

    interface ReactionCountProjection {

        UUID getPostId();

        ReactionType getType();

        long getTotal();
    }
}
