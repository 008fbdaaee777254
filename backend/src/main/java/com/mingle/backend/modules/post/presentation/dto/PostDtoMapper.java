package com.mingle.backend.modules.post.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.mingle.backend.modules.comment.presentation.dto.CommentResponse;
import com.mingle.backend.modules.engagement.domain.ReactionTally;
import com.mingle.backend.modules.post.domain.Post;

public final class PostDtoMapper {

    private PostDtoMapper() {
    }

    public static PostResponse toResponse(
            Post post,
            OffsetDateTime now,
            ReactionTally tally,
            List<CommentResponse> comments
    ) {
        ReactionTally counts = tally == null ? ReactionTally.EMPTY : tally;
        List<CommentResponse> thread = comments == null ? List.of() : List.copyOf(comments);
        return new PostResponse(
                post.getId(),
                post.getTitle(),
                post.getTopics(),
                post.getBody(),
                OwnerResponse.of(post.getOwner()),
                post.getCreatedAt(),
                post.getExpiresAt(),
                post.getExpiresInMinutes(),
                post.lifecycleAt(now),
                counts.likes(),
                counts.dislikes(),
                thread.size(),
                thread
        );
    }

    /**
     * Shape for a post that was just published and has no engagement yet.
     */
    public static PostResponse toFreshResponse(Post post, OffsetDateTime now) {
        return toResponse(post, now, ReactionTally.EMPTY, List.of());
    }
}
