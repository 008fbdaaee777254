package com.mingle.backend.modules.post.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.mingle.backend.modules.comment.presentation.dto.CommentResponse;
import com.mingle.backend.modules.post.domain.PostLifecycle;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PostResponse(
        @JsonProperty("_id") UUID id,
        String title,
        List<String> topics,
        String body,
        OwnerResponse owner,
        OffsetDateTime createdAt,
        OffsetDateTime expiresAt,
        int expiresInMinutes,
        PostLifecycle status,
        long likesCount,
        long dislikesCount,
        long commentsCount,
        List<CommentResponse> comments
) {
}
