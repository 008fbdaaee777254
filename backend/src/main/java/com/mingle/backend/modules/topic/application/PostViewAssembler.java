package com.mingle.backend.modules.topic.application;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.mingle.backend.modules.comment.domain.PostComment;
import com.mingle.backend.modules.comment.infrastructure.persistence.PostCommentRepository;
import com.mingle.backend.modules.comment.presentation.dto.CommentResponse;
import com.mingle.backend.modules.engagement.application.EngagementService;
import com.mingle.backend.modules.engagement.domain.ReactionTally;
import com.mingle.backend.modules.post.domain.Post;
import com.mingle.backend.modules.post.presentation.dto.PostDtoMapper;
import com.mingle.backend.modules.post.presentation.dto.PostResponse;
import com.mingle.backend.modules.topic.domain.PostActivity;

import org.springframework.stereotype.Component;

/**
 * Enriches posts with counters and comment threads using one grouped query per
 * relation, whatever the size of the page.
 */
@Component
public class PostViewAssembler {

    private final EngagementService engagementService;
    private final PostCommentRepository commentRepository;

    public PostViewAssembler(EngagementService engagementService, PostCommentRepository commentRepository) {
        this.engagementService = engagementService;
        this.commentRepository = commentRepository;
    }

    public List<PostResponse> toViews(List<Post> posts, OffsetDateTime now) {
        if (posts.isEmpty()) {
            return List.of();
        }
        List<UUID> ids = posts.stream().map(Post::getId).toList();
        Map<UUID, ReactionTally> tallies = engagementService.tallyFor(ids);
        Map<UUID, List<CommentResponse>> threads = new HashMap<>();
        for (PostComment comment : commentRepository.findThreads(ids)) {
            threads.computeIfAbsent(comment.getPost().getId(), key -> new ArrayList<>())
                    .add(CommentResponse.of(comment));
        }
        return posts.stream()
                .map(post -> PostDtoMapper.toResponse(post, now, tallies.get(post.getId()), threads.get(post.getId())))
                .toList();
    }

    public PostResponse toView(Post post, OffsetDateTime now) {
        return toViews(List.of(post), now).get(0);
    }

    public List<PostActivity> activityOf(List<Post> posts) {
        if (posts.isEmpty()) {
            return List.of();
        }
        List<UUID> ids = posts.stream().map(Post::getId).toList();
        Map<UUID, ReactionTally> tallies = engagementService.tallyFor(ids);
        Map<UUID, Long> comments = new HashMap<>();
        for (PostCommentRepository.CommentCountProjection row : commentRepository.countByPostIds(ids)) {
            comments.put(row.getPostId(), row.getTotal());
        }
        return posts.stream()
                .map(post -> {
                    ReactionTally tally = tallies.getOrDefault(post.getId(), ReactionTally.EMPTY);
                    return new PostActivity(
                            post.getId(),
                            post.getCreatedAt(),
                            tally.likes(),
                            tally.dislikes(),
                            comments.getOrDefault(post.getId(), 0L)
                    );
                })
                .toList();
    }
}
