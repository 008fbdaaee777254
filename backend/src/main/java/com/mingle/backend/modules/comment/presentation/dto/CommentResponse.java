package com.mingle.backend.modules.comment.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.mingle.backend.modules.auth.presentation.dto.UserSummaryResponse;
import com.mingle.backend.modules.comment.domain.PostComment;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CommentResponse(
        @JsonProperty("_id") UUID id,
        UserSummaryResponse user,
        String text,
        OffsetDateTime createdAt
) {

    public static CommentResponse of(PostComment comment) {
        return new CommentResponse(
                comment.getId(),
                UserSummaryResponse.of(comment.getAuthor()),
                comment.getText(),
                comment.getCreatedAt()
        );
    }
}
