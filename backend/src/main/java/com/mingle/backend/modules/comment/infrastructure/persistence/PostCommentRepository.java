package com.mingle.backend.modules.comment.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.mingle.backend.modules.comment.domain.PostComment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PostCommentRepository extends JpaRepository<PostComment, UUID> {

    @Query("""
            select c
              from PostComment c
              join fetch c.author
             where c.post.id = :postId
             order by c.createdAt asc, c.seq asc
            """)
    List<PostComment> findThread(@Param("postId") UUID postId);

    @Query("""
            select c
              from PostComment c
              join fetch c.author
             where c.post.id in :postIds
             order by c.createdAt asc, c.seq asc
            """)
    List<PostComment> findThreads(@Param("postIds") Collection<UUID> postIds);

    @Query("select count(c) from PostComment c where c.post.id = :postId")
    long countByPostId(@Param("postId") UUID postId);

    @Query("""
            select c.post.id as postId, count(c) as total
              from PostComment c
             where c.post.id in :postIds
             group by c.post.id
            """)
    List<CommentCountProjection> countByPostIds(@Param("postIds") Collection<UUID> postIds);

    interface CommentCountProjection {

        UUID getPostId();

        long getTotal();
    }
}
