package com.mingle.backend.modules.post.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import com.mingle.backend.modules.post.domain.Post;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PostRepository extends JpaRepository<Post, UUID> {

    /**
     * Row lock that serialises every reaction change on one post.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Post p where p.id = :id")
    Optional<Post> findByIdForUpdate(@Param("id") UUID id);

    @EntityGraph(attributePaths = "owner")
    @Query("select p from Post p where p.id = :id")
    Optional<Post> findWithOwnerById(@Param("id") UUID id);

    @EntityGraph(attributePaths = "owner")
    @Query("select p from Post p order by p.createdAt asc, p.id asc")
    List<Post> findAllInCreationOrder();

    @EntityGraph(attributePaths = "owner")
    @Query("""
            select p
              from Post p
              join p.topics t
             where t = :topic
             order by p.createdAt asc, p.id asc
            """)
    List<Post> findByTopic(@Param("topic") String topic);

    @EntityGraph(attributePaths = "owner")
    @Query("""
            select p
              from Post p
              join p.topics t
             where t = :topic
               and p.expiresAt > :now
             order by p.createdAt asc, p.id asc
            """)
    List<Post> findLiveByTopic(@Param("topic") String topic, @Param("now") OffsetDateTime now);

    @EntityGraph(attributePaths = "owner")
    @Query("""
            select p
              from Post p
              join p.topics t
             where t = :topic
               and p.expiresAt <= :now
             order by p.expiresAt desc, p.id asc
            """)
    List<Post> findExpiredByTopic(@Param("topic") String topic, @Param("now") OffsetDateTime now);
}
